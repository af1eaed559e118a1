package io.github.chirino.access.feature;

import io.github.chirino.access.model.AvailableFeature;
import java.util.Set;

/** Answers which features an organization has available. */
public interface FeatureGate {

    Set<AvailableFeature> availableFeatures(String organizationId);

    default boolean isFeatureAvailable(String organizationId, AvailableFeature feature) {
        return availableFeatures(organizationId).contains(feature);
    }

    default boolean isRoleBasedAccessAvailable(String organizationId) {
        return enablesRoleBasedAccess(availableFeatures(organizationId));
    }

    default boolean isAccessControlAvailable(String organizationId) {
        return enablesAccessControl(availableFeatures(organizationId));
    }

    static boolean enablesRoleBasedAccess(Set<AvailableFeature> features) {
        return features.contains(AvailableFeature.ROLE_BASED_ACCESS);
    }

    /**
     * Access controls are enabled by either of the two legacy permission features; both now
     * apply to the generic access control.
     */
    static boolean enablesAccessControl(Set<AvailableFeature> features) {
        return features.contains(AvailableFeature.PROJECT_BASED_PERMISSIONING)
                || features.contains(AvailableFeature.ADVANCED_PERMISSIONS);
    }
}
