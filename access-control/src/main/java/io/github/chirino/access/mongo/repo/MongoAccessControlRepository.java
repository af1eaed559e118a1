package io.github.chirino.access.mongo.repo;

import com.mongodb.client.model.Filters;
import io.github.chirino.access.mongo.model.MongoAccessControl;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.bson.conversions.Bson;

@ApplicationScoped
public class MongoAccessControlRepository
        implements PanacheMongoRepositoryBase<MongoAccessControl, String> {

    /**
     * Grants on the resource that are team-wide, on {@code organizationMemberId} (when set) or on
     * one of {@code roleIds}.
     */
    public List<MongoAccessControl> listMatching(
            String teamId,
            String resource,
            String resourceId,
            String organizationMemberId,
            Set<String> roleIds) {
        Bson filter =
                Filters.and(
                        Filters.eq("teamId", teamId),
                        Filters.eq("resource", resource),
                        Filters.eq("resourceId", resourceId),
                        scopeFilter(organizationMemberId, roleIds));
        return mongoCollection().find(filter).into(new ArrayList<>());
    }

    static Bson scopeFilter(String organizationMemberId, Set<String> roleIds) {
        List<Bson> scopes = new ArrayList<>();
        scopes.add(
                Filters.and(
                        Filters.eq("organizationMemberId", null), Filters.eq("roleId", null)));
        if (organizationMemberId != null) {
            scopes.add(
                    Filters.and(
                            Filters.eq("organizationMemberId", organizationMemberId),
                            Filters.eq("roleId", null)));
        }
        if (roleIds != null && !roleIds.isEmpty()) {
            scopes.add(
                    Filters.and(
                            Filters.eq("organizationMemberId", null),
                            Filters.in("roleId", roleIds)));
        }
        return Filters.or(scopes);
    }
}
