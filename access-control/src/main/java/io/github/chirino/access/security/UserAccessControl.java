package io.github.chirino.access.security;

import io.github.chirino.access.feature.FeatureGate;
import io.github.chirino.access.model.AccessCheck;
import io.github.chirino.access.model.AccessControl;
import io.github.chirino.access.model.AccessControlQuery;
import io.github.chirino.access.model.AccessControlled;
import io.github.chirino.access.model.AccessLevel;
import io.github.chirino.access.model.AccessLevels;
import io.github.chirino.access.model.AvailableFeature;
import io.github.chirino.access.model.OrganizationMembership;
import io.github.chirino.access.model.Team;
import io.github.chirino.access.store.AccessControlStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Resolves the access a single user has on objects inside a single team.
 *
 * <p>The organization membership, the user's roles and the organization's feature flags are
 * looked up at most once per instance, so an instance should live no longer than one request and
 * must not be shared between threads.
 */
public class UserAccessControl {

    private static final Logger LOG = Logger.getLogger(UserAccessControl.class);

    private final String userId;
    private final Team team;
    private final AccessControlStore store;
    private final FeatureGate featureGate;
    private final ResourceKindRegistry resourceKinds;
    private final AccessDecisionAuditLogger auditLogger;

    private Optional<OrganizationMembership> organizationMembership;
    private Set<String> roleIds;
    private Set<AvailableFeature> availableFeatures;

    public UserAccessControl(
            String userId,
            Team team,
            AccessControlStore store,
            FeatureGate featureGate,
            ResourceKindRegistry resourceKinds,
            AccessDecisionAuditLogger auditLogger) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.team = Objects.requireNonNull(team, "team");
        this.store = Objects.requireNonNull(store, "store");
        this.featureGate = Objects.requireNonNull(featureGate, "featureGate");
        this.resourceKinds = Objects.requireNonNull(resourceKinds, "resourceKinds");
        this.auditLogger = auditLogger;
    }

    public String getUserId() {
        return userId;
    }

    public Team getTeam() {
        return team;
    }

    public boolean isRbacSupported() {
        return FeatureGate.enablesRoleBasedAccess(getAvailableFeatures());
    }

    public boolean isAccessControlsSupported() {
        return FeatureGate.enablesAccessControl(getAvailableFeatures());
    }

    public Optional<OrganizationMembership> getOrganizationMembership() {
        if (organizationMembership == null) {
            organizationMembership =
                    store.findOrganizationMembership(team.organizationId(), userId);
        }
        return organizationMembership;
    }

    /** Resource kind of {@code object}; fails with {@link UnknownResourceKindException}. */
    public String resourceKindOf(AccessControlled object) {
        return resourceKinds.resourceKindOf(object);
    }

    /**
     * Stored grants for {@code object} that apply to this user: team-wide grants, grants on the
     * user's organization membership and, when role-based access is available, grants on the
     * user's roles.
     */
    public List<AccessControl> accessControlsForObject(AccessControlled object) {
        String resource = resourceKindOf(object);
        String organizationMemberId =
                getOrganizationMembership().map(OrganizationMembership::id).orElse(null);
        AccessControlQuery query =
                new AccessControlQuery(
                        team.id(),
                        resource,
                        String.valueOf(object.id()),
                        organizationMemberId,
                        getRoleIds());
        return store.findAccessControls(query);
    }

    /**
     * The highest access control that applies to {@code object}, or empty when access controls
     * do not apply to this user at all. Returned controls may be virtual: organization admins get
     * the top level of the resource and objects without grants get the resource default.
     */
    public Optional<AccessControl> accessControlForObject(AccessControlled object) {
        String resource = resourceKindOf(object);
        String resourceId = String.valueOf(object.id());

        if (!isAccessControlsSupported()) {
            return Optional.empty();
        }

        Optional<OrganizationMembership> membership = getOrganizationMembership();
        if (membership.isEmpty()) {
            // the organization permission check normally rejects these users first
            LOG.debugf(
                    "User %s has no membership in organization %s",
                    userId, team.organizationId());
            return Optional.empty();
        }

        if (membership.get().isAdmin()) {
            return Optional.of(
                    AccessControl.virtual(
                            team.id(),
                            resource,
                            resourceId,
                            AccessLevels.highestAccessLevel(resource)));
        }

        List<AccessControl> accessControls = accessControlsForObject(object);
        if (accessControls.isEmpty()) {
            return Optional.of(
                    AccessControl.virtual(
                            team.id(),
                            resource,
                            resourceId,
                            AccessLevels.defaultAccessLevel(resource)));
        }

        return AccessLevels.highest(resource, accessControls, AccessControl::accessLevel);
    }

    /** Level the user effectively has on {@code object}, empty when no control applies. */
    public Optional<AccessLevel> userAccessLevel(AccessControlled object) {
        return accessControlForObject(object).map(AccessControl::accessLevel);
    }

    /**
     * Checks whether the user has at least {@code requiredLevel} on {@code object}. Returns
     * {@link AccessCheck#UNRESTRICTED} when no access control applies.
     */
    public AccessCheck checkAccessLevelForObject(
            AccessControlled object, AccessLevel requiredLevel) {
        Objects.requireNonNull(requiredLevel, "requiredLevel");
        Optional<AccessControl> accessControl = accessControlForObject(object);
        if (accessControl.isEmpty()) {
            return AccessCheck.UNRESTRICTED;
        }
        AccessControl control = accessControl.get();
        boolean satisfied =
                AccessLevels.accessLevelSatisfied(
                        control.resource(), control.accessLevel(), requiredLevel);
        LOG.debugf(
                "User %s has %s on %s %s, required %s: %s",
                userId,
                control.accessLevel().toValue(),
                control.resource(),
                control.resourceId(),
                requiredLevel.toValue(),
                satisfied);
        if (!satisfied && auditLogger != null) {
            auditLogger.logDenied(
                    userId,
                    team.id(),
                    control.resource(),
                    control.resourceId(),
                    requiredLevel,
                    control.accessLevel());
        }
        return AccessCheck.of(satisfied);
    }

    /**
     * Creators may always change who can access their objects. Everyone else needs admin access
     * on the team itself.
     */
    public AccessCheck checkCanModifyAccessLevelsForObject(AccessControlled object) {
        if (userId.equals(object.createdBy())) {
            return AccessCheck.GRANTED;
        }
        return checkAccessLevelForObject(team, AccessLevel.ADMIN);
    }

    /**
     * Restricts {@code objects} to those the user may see.
     *
     * <p>TODO: filter by the user's explicit project grants once the default project access
     * setting (opt-in vs opt-out) is stored; until then every object is returned.
     */
    public <T extends AccessControlled> List<T> filterByAccessLevel(List<T> objects) {
        return objects;
    }

    private Set<AvailableFeature> getAvailableFeatures() {
        if (availableFeatures == null) {
            availableFeatures = featureGate.availableFeatures(team.organizationId());
        }
        return availableFeatures;
    }

    private Set<String> getRoleIds() {
        if (roleIds == null) {
            roleIds = isRbacSupported() ? store.findRoleIds(userId) : Set.of();
        }
        return roleIds;
    }
}
