package io.github.chirino.access.mongo.repo;

import io.github.chirino.access.mongo.model.MongoOrganizationMembership;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Optional;

@ApplicationScoped
public class MongoOrganizationMembershipRepository
        implements PanacheMongoRepositoryBase<MongoOrganizationMembership, String> {

    public Optional<MongoOrganizationMembership> findMembership(
            String organizationId, String userId) {
        return find("organizationId = ?1 and userId = ?2", organizationId, userId)
                .firstResultOptional();
    }
}
