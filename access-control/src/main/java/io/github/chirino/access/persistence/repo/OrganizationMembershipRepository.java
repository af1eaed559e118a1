package io.github.chirino.access.persistence.repo;

import io.github.chirino.access.persistence.entity.OrganizationMembershipEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class OrganizationMembershipRepository
        implements PanacheRepositoryBase<OrganizationMembershipEntity, UUID> {

    public Optional<OrganizationMembershipEntity> findMembership(
            UUID organizationId, String userId) {
        return find(
                        "organization.id = ?1 AND userId = ?2 AND organization.deletedAt IS NULL",
                        organizationId,
                        userId)
                .firstResultOptional();
    }
}
