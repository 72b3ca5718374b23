package com.vidnyan.uast.domain.node;

/**
 * Role tag not declared in {@link UastRole}. Declared tags are rejected so one tag
 * always maps to one role.
 */
public record CustomRole(String tag) implements Role {

    public CustomRole {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Role tag must not be blank");
        }
        UastRole declared = UastRole.fromTag(tag).orElse(null);
        if (declared != null) {
            throw new IllegalArgumentException("Role tag '" + tag + "' is declared as UastRole." + declared.name());
        }
    }

    @Override
    public String toString() {
        return tag;
    }
}
