package io.github.chirino.access.security;

import io.github.chirino.access.config.AccessControlStoreSelector;
import io.github.chirino.access.feature.FeatureGate;
import io.github.chirino.access.model.Team;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/** Creates {@link UserAccessControl} instances bound to one user and one team. */
@ApplicationScoped
public class UserAccessControlFactory {

    @Inject AccessControlStoreSelector storeSelector;

    @Inject FeatureGate featureGate;

    @Inject ResourceKindRegistry resourceKindRegistry;

    @Inject AccessDecisionAuditLogger auditLogger;

    public UserAccessControl forUser(String userId, Team team) {
        return new UserAccessControl(
                userId,
                team,
                storeSelector.getStore(),
                featureGate,
                resourceKindRegistry,
                auditLogger);
    }
}
