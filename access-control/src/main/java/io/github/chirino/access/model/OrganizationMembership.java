package io.github.chirino.access.model;

import java.util.Objects;

public record OrganizationMembership(
        String id, String organizationId, String userId, OrganizationMembershipLevel level) {

    public OrganizationMembership {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(level, "level");
    }

    public boolean isAdmin() {
        return level.isAtLeast(OrganizationMembershipLevel.ADMIN);
    }
}
