package com.vidnyan.uast.domain.node;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, duplicate-free set of roles. The first role added is the primary one.
 * Immutable; use {@link Builder} to accumulate.
 */
public final class RoleSet implements Iterable<Role> {

    private static final RoleSet EMPTY = new RoleSet(List.of());

    private final List<Role> roles;

    private RoleSet(List<Role> roles) {
        this.roles = roles;
    }

    public static RoleSet empty() {
        return EMPTY;
    }

    public static RoleSet of(Role... roles) {
        return builder().addAll(List.of(roles)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(Role role) {
        return roles.contains(role);
    }

    public boolean containsAll(Collection<? extends Role> other) {
        return roles.containsAll(other);
    }

    public boolean isEmpty() {
        return roles.isEmpty();
    }

    public int size() {
        return roles.size();
    }

    /**
     * Primary classification, i.e. the first role attached.
     */
    public Role primary() {
        if (roles.isEmpty()) {
            throw new IllegalStateException("Empty role set has no primary role");
        }
        return roles.get(0);
    }

    public List<Role> asList() {
        return roles;
    }

    public List<String> tags() {
        return roles.stream().map(Role::tag).toList();
    }

    @Override
    public Iterator<Role> iterator() {
        return roles.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleSet other)) return false;
        return roles.equals(other.roles);
    }

    @Override
    public int hashCode() {
        return roles.hashCode();
    }

    @Override
    public String toString() {
        return roles.stream().map(Role::tag).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Grow-only accumulator. Roles can be added but never removed.
     */
    public static final class Builder {
        private final Set<Role> roles = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder add(Role role) {
            roles.add(role);
            return this;
        }

        public Builder addAll(Collection<? extends Role> more) {
            roles.addAll(more);
            return this;
        }

        public int size() {
            return roles.size();
        }

        public RoleSet build() {
            if (roles.isEmpty()) {
                return EMPTY;
            }
            return new RoleSet(List.copyOf(roles));
        }
    }
}
