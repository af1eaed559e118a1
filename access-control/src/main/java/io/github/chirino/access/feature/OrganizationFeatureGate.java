package io.github.chirino.access.feature;

import io.github.chirino.access.config.AccessControlStoreSelector;
import io.github.chirino.access.model.AvailableFeature;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Feature gate backed by the organization's stored feature list. Features listed in {@code
 * access-control.features.always-available} are on for every organization.
 */
@ApplicationScoped
public class OrganizationFeatureGate implements FeatureGate {

    private static final Logger LOG = Logger.getLogger(OrganizationFeatureGate.class);

    @Inject AccessControlStoreSelector storeSelector;

    @ConfigProperty(name = "access-control.features.always-available")
    Optional<List<String>> alwaysAvailable;

    @Override
    public Set<AvailableFeature> availableFeatures(String organizationId) {
        Set<AvailableFeature> features = EnumSet.noneOf(AvailableFeature.class);
        features.addAll(storeSelector.getStore().findAvailableFeatures(organizationId));
        for (AvailableFeature feature : AvailableFeature.values()) {
            if (isAlwaysAvailable(feature)) {
                features.add(feature);
            }
        }
        LOG.debugf("Features available for organization %s: %s", organizationId, features);
        return features;
    }

    @Override
    public boolean isFeatureAvailable(String organizationId, AvailableFeature feature) {
        return isAlwaysAvailable(feature) || availableFeatures(organizationId).contains(feature);
    }

    private boolean isAlwaysAvailable(AvailableFeature feature) {
        if (alwaysAvailable == null || alwaysAvailable.isEmpty()) {
            return false;
        }
        for (String value : alwaysAvailable.get()) {
            if (AvailableFeature.fromValue(value).filter(feature::equals).isPresent()) {
                return true;
            }
        }
        return false;
    }
}
