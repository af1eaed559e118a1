package io.github.chirino.access.model;

import java.util.Objects;
import java.util.Set;

/**
 * Filter criteria for the grants that apply to one user on one object. A stored grant matches
 * when team, resource and resource id are equal and it is either team-wide, scoped to {@code
 * organizationMemberId}, or scoped to one of {@code roleIds}. A {@code null} member id matches
 * no member-scoped grant.
 */
public record AccessControlQuery(
        String teamId,
        String resource,
        String resourceId,
        String organizationMemberId,
        Set<String> roleIds) {

    public AccessControlQuery {
        Objects.requireNonNull(teamId, "teamId");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(resourceId, "resourceId");
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }

    public boolean includesMember() {
        return organizationMemberId != null;
    }

    public boolean includesRoles() {
        return !roleIds.isEmpty();
    }
}
