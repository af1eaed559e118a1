package io.github.chirino.access.mongo.repo;

import io.github.chirino.access.mongo.model.MongoOrganization;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Optional;

@ApplicationScoped
public class MongoOrganizationRepository
        implements PanacheMongoRepositoryBase<MongoOrganization, String> {

    public Optional<MongoOrganization> findActiveById(String id) {
        return Optional.ofNullable(findById(id)).filter(o -> o.deletedAt == null);
    }
}
