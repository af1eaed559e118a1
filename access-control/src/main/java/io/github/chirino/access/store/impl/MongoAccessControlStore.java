package io.github.chirino.access.store.impl;

import io.github.chirino.access.model.AccessControl;
import io.github.chirino.access.model.AccessControlQuery;
import io.github.chirino.access.model.AccessLevel;
import io.github.chirino.access.model.AccessLevels;
import io.github.chirino.access.model.AvailableFeature;
import io.github.chirino.access.model.OrganizationMembership;
import io.github.chirino.access.model.OrganizationMembershipLevel;
import io.github.chirino.access.mongo.model.MongoAccessControl;
import io.github.chirino.access.mongo.repo.MongoAccessControlRepository;
import io.github.chirino.access.mongo.repo.MongoOrganizationMembershipRepository;
import io.github.chirino.access.mongo.repo.MongoOrganizationRepository;
import io.github.chirino.access.mongo.repo.MongoRoleMembershipRepository;
import io.github.chirino.access.store.AccessControlStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/** MongoDB store. Ids are stored as plain strings. */
@ApplicationScoped
public class MongoAccessControlStore implements AccessControlStore {

    private static final Logger LOG = Logger.getLogger(MongoAccessControlStore.class);

    @Inject MongoAccessControlRepository accessControlRepository;

    @Inject MongoOrganizationRepository organizationRepository;

    @Inject MongoOrganizationMembershipRepository organizationMembershipRepository;

    @Inject MongoRoleMembershipRepository roleMembershipRepository;

    @Override
    public List<AccessControl> findAccessControls(AccessControlQuery query) {
        return accessControlRepository
                .listMatching(
                        query.teamId(),
                        query.resource(),
                        query.resourceId(),
                        query.organizationMemberId(),
                        query.roleIds())
                .stream()
                .map(MongoAccessControlStore::toAccessControl)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<OrganizationMembership> findOrganizationMembership(
            String organizationId, String userId) {
        if (organizationRepository.findActiveById(organizationId).isEmpty()) {
            return Optional.empty();
        }
        return organizationMembershipRepository
                .findMembership(organizationId, userId)
                .map(
                        m ->
                                new OrganizationMembership(
                                        m.id,
                                        m.organizationId,
                                        m.userId,
                                        OrganizationMembershipLevel.fromValue(m.level)));
    }

    @Override
    public Set<String> findRoleIds(String userId) {
        return new LinkedHashSet<>(roleMembershipRepository.listRoleIdsForUser(userId));
    }

    @Override
    public Set<AvailableFeature> findAvailableFeatures(String organizationId) {
        Set<AvailableFeature> result = EnumSet.noneOf(AvailableFeature.class);
        organizationRepository
                .findActiveById(organizationId)
                .ifPresent(
                        organization -> {
                            if (organization.availableFeatures == null) {
                                return;
                            }
                            for (String key : organization.availableFeatures) {
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

    static Optional<AccessControl> toAccessControl(MongoAccessControl document) {
        AccessLevel accessLevel = AccessLevel.fromValue(document.accessLevel).orElse(null);
        if (!AccessLevels.isValid(document.resource, accessLevel)
                || (document.organizationMemberId != null && document.roleId != null)) {
            LOG.warnf(
                    "Ignoring malformed access control %s on resource %s",
                    document.id, document.resource);
            return Optional.empty();
        }
        return Optional.of(
                new AccessControl(
                        document.id,
                        document.teamId,
                        document.resource,
                        document.resourceId,
                        document.organizationMemberId,
                        document.roleId,
                        accessLevel));
    }
}
