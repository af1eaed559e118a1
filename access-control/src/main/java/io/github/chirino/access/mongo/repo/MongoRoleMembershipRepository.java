package io.github.chirino.access.mongo.repo;

import io.github.chirino.access.mongo.model.MongoRoleMembership;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.stream.Collectors;

@ApplicationScoped
public class MongoRoleMembershipRepository
        implements PanacheMongoRepositoryBase<MongoRoleMembership, String> {

    public List<String> listRoleIdsForUser(String userId) {
        return find("userId", userId).stream()
                .map(m -> m.roleId)
                .distinct()
                .collect(Collectors.toList());
    }
}
