package io.github.chirino.access.security;

import io.github.chirino.access.model.AccessLevel;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class AccessDecisionAuditLogger {

    private static final Logger AUDIT_LOG = Logger.getLogger("io.github.chirino.access.audit");

    @ConfigProperty(name = "access-control.audit.enabled", defaultValue = "true")
    boolean enabled;

    /** Log a check that was denied by an access control. */
    public void logDenied(
            String userId,
            String teamId,
            String resource,
            String resourceId,
            AccessLevel required,
            AccessLevel effective) {
        if (!enabled) {
            return;
        }
        AUDIT_LOG.infof(
                "ACCESS_DENIED user=%s team=%s resource=%s id=%s required=%s effective=%s",
                userId,
                teamId,
                resource,
                resourceId,
                required.toValue(),
                effective.toValue());
    }
}
