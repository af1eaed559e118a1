package io.github.chirino.access.store.impl;

import io.github.chirino.access.model.AccessControl;
import io.github.chirino.access.model.AccessControlQuery;
import io.github.chirino.access.model.AccessLevels;
import io.github.chirino.access.model.AvailableFeature;
import io.github.chirino.access.model.OrganizationMembership;
import io.github.chirino.access.model.OrganizationMembershipLevel;
import io.github.chirino.access.persistence.entity.AccessControlEntity;
import io.github.chirino.access.persistence.entity.OrganizationMembershipEntity;
import io.github.chirino.access.persistence.repo.AccessControlRepository;
import io.github.chirino.access.persistence.repo.OrganizationMembershipRepository;
import io.github.chirino.access.persistence.repo.OrganizationRepository;
import io.github.chirino.access.persistence.repo.RoleMembershipRepository;
import io.github.chirino.access.store.AccessControlStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * PostgreSQL store. Identifiers are UUIDs in the database; ids that do not parse as UUIDs cannot
 * reference any row and resolve to empty results.
 */
@ApplicationScoped
public class PostgresAccessControlStore implements AccessControlStore {

    private static final Logger LOG = Logger.getLogger(PostgresAccessControlStore.class);

    @Inject AccessControlRepository accessControlRepository;

    @Inject OrganizationRepository organizationRepository;

    @Inject OrganizationMembershipRepository organizationMembershipRepository;

    @Inject RoleMembershipRepository roleMembershipRepository;

    @Override
    public List<AccessControl> findAccessControls(AccessControlQuery query) {
        Optional<UUID> teamId = parseUuid(query.teamId());
        if (teamId.isEmpty()) {
            return List.of();
        }
        UUID organizationMemberId = parseUuid(query.organizationMemberId()).orElse(null);
        Set<UUID> roleIds = new LinkedHashSet<>();
        for (String roleId : query.roleIds()) {
            parseUuid(roleId).ifPresent(roleIds::add);
        }

        List<AccessControlEntity> entities =
                accessControlRepository.listMatching(
                        teamId.get(),
                        query.resource(),
                        query.resourceId(),
                        organizationMemberId,
                        roleIds);
        List<AccessControl> result = new ArrayList<>(entities.size());
        for (AccessControlEntity entity : entities) {
            toAccessControl(entity).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public Optional<OrganizationMembership> findOrganizationMembership(
            String organizationId, String userId) {
        return parseUuid(organizationId)
                .flatMap(orgId -> organizationMembershipRepository.findMembership(orgId, userId))
                .map(entity -> toMembership(organizationId, entity));
    }

    @Override
    public Set<String> findRoleIds(String userId) {
        Set<String> result = new LinkedHashSet<>();
        for (UUID roleId : roleMembershipRepository.listRoleIdsForUser(userId)) {
            result.add(roleId.toString());
        }
        return result;
    }

    @Override
    public Set<AvailableFeature> findAvailableFeatures(String organizationId) {
        Set<AvailableFeature> result = EnumSet.noneOf(AvailableFeature.class);
        parseUuid(organizationId)
                .flatMap(organizationRepository::findActiveById)
                .ifPresent(
                        organization -> {
                            for (String key : organization.getAvailableFeatures()) {
                                Optional<AvailableFeature> feature =
                                        AvailableFeature.fromValue(key);
                                if (feature.isPresent()) {
                                    result.add(feature.get());
                                } else {
                                    LOG.warnf(
                                            "Ignoring unknown feature %s on organization %s",
                                            key, organizationId);
                                }
                            }
                        });
        return result;
    }

    static Optional<AccessControl> toAccessControl(AccessControlEntity entity) {
        if (!AccessLevels.isValid(entity.getResource(), entity.getAccessLevel())
                || (entity.getOrganizationMemberId() != null && entity.getRoleId() != null)) {
            LOG.warnf(
                    "Ignoring malformed access control %s on resource %s",
                    entity.getId(), entity.getResource());
            return Optional.empty();
        }
        return Optional.of(
                new AccessControl(
                        entity.getId().toString(),
                        entity.getTeamId().toString(),
                        entity.getResource(),
                        entity.getResourceId(),
                        toStringOrNull(entity.getOrganizationMemberId()),
                        toStringOrNull(entity.getRoleId()),
                        entity.getAccessLevel()));
    }

    private static OrganizationMembership toMembership(
            String organizationId, OrganizationMembershipEntity entity) {
        return new OrganizationMembership(
                entity.getId().toString(),
                organizationId,
                entity.getUserId(),
                OrganizationMembershipLevel.fromValue(entity.getLevel()));
    }

    private static String toStringOrNull(UUID value) {
        return value == null ? null : value.toString();
    }

    static Optional<UUID> parseUuid(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            LOG.debugf("Not a UUID, nothing can match: %s", value);
            return Optional.empty();
        }
    }
}
