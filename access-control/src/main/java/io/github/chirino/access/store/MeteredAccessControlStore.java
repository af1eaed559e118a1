package io.github.chirino.access.store;

import io.github.chirino.access.model.AccessControl;
import io.github.chirino.access.model.AccessControlQuery;
import io.github.chirino.access.model.AvailableFeature;
import io.github.chirino.access.model.OrganizationMembership;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decorator that records a Micrometer timer named "access.control.store.operation" around every
 * store call, tagged with the operation name.
 */
public class MeteredAccessControlStore implements AccessControlStore {

    static final String METRIC_NAME = "access.control.store.operation";

    private final MeterRegistry registry;
    private final AccessControlStore delegate;

    public MeteredAccessControlStore(MeterRegistry registry, AccessControlStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    public AccessControlStore getDelegate() {
        return delegate;
    }

    @Override
    public List<AccessControl> findAccessControls(AccessControlQuery query) {
        return registry.timer(METRIC_NAME, "operation", "findAccessControls")
                .record(() -> delegate.findAccessControls(query));
    }

    @Override
    public Optional<OrganizationMembership> findOrganizationMembership(
            String organizationId, String userId) {
        return registry.timer(METRIC_NAME, "operation", "findOrganizationMembership")
                .record(() -> delegate.findOrganizationMembership(organizationId, userId));
    }

    @Override
    public Set<String> findRoleIds(String userId) {
        return registry.timer(METRIC_NAME, "operation", "findRoleIds")
                .record(() -> delegate.findRoleIds(userId));
    }

    @Override
    public Set<AvailableFeature> findAvailableFeatures(String organizationId) {
        return registry.timer(METRIC_NAME, "operation", "findAvailableFeatures")
                .record(() -> delegate.findAvailableFeatures(organizationId));
    }
}
