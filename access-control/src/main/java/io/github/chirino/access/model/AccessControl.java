package io.github.chirino.access.model;

import java.util.Objects;

/**
 * A grant of an access level on a resource inside a team. With neither {@code
 * organizationMemberId} nor {@code roleId} set the grant applies to the whole team.
 *
 * <p>Virtual grants are synthesized by the resolver and have no {@code id}.
 */
public record AccessControl(
        String id,
        String teamId,
        String resource,
        String resourceId,
        String organizationMemberId,
        String roleId,
        AccessLevel accessLevel) {

    public AccessControl {
        Objects.requireNonNull(teamId, "teamId");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(accessLevel, "accessLevel");
        if (organizationMemberId != null && roleId != null) {
            throw new IllegalArgumentException(
                    "Access control cannot target both an organization member and a role");
        }
        if (!AccessLevels.isValid(resource, accessLevel)) {
            throw new IllegalArgumentException(
                    "Access level "
                            + accessLevel.toValue()
                            + " is not valid for resource "
                            + resource);
        }
    }

    public static AccessControl virtual(
            String teamId, String resource, String resourceId, AccessLevel accessLevel) {
        return new AccessControl(null, teamId, resource, resourceId, null, null, accessLevel);
    }

    public boolean isVirtual() {
        return id == null;
    }

    public boolean isTeamWide() {
        return organizationMemberId == null && roleId == null;
    }
}
