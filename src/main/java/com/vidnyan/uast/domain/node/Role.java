package com.vidnyan.uast.domain.node;

/**
 * A semantic tag attached to an annotated node.
 * Either one of the declared {@link UastRole}s or a {@link CustomRole}.
 */
public interface Role {

    /**
     * Tag as it appears in the output tree, e.g. {@code Binary}.
     */
    String tag();

    /**
     * Resolve a tag to a declared role, falling back to a custom one.
     */
    static Role of(String tag) {
        return UastRole.fromTag(tag)
                .<Role>map(r -> r)
                .orElseGet(() -> new CustomRole(tag));
    }
}
