package io.github.chirino.access.store;

import io.github.chirino.access.model.AccessControl;
import io.github.chirino.access.model.AccessControlQuery;
import io.github.chirino.access.model.AvailableFeature;
import io.github.chirino.access.model.OrganizationMembership;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over the records access resolution depends on. Implementations translate the
 * requests into their datastore's native queries; datastore failures propagate unchanged.
 */
public interface AccessControlStore {

    /** Returns the stored grants matching {@code query}. */
    List<AccessControl> findAccessControls(AccessControlQuery query);

    Optional<OrganizationMembership> findOrganizationMembership(
            String organizationId, String userId);

    /** Ids of the roles the user currently holds. */
    Set<String> findRoleIds(String userId);

    /** Features enabled for the organization; empty when the organization does not exist. */
    Set<AvailableFeature> findAvailableFeatures(String organizationId);
}
