package io.github.chirino.access.persistence.repo;

import io.github.chirino.access.persistence.entity.AccessControlEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@ApplicationScoped
public class AccessControlRepository implements PanacheRepositoryBase<AccessControlEntity, UUID> {

    /** HQL restriction with its named parameters. */
    public record Filter(String query, Map<String, Object> parameters) {}

    public List<AccessControlEntity> listMatching(
            UUID teamId,
            String resource,
            String resourceId,
            UUID organizationMemberId,
            Set<UUID> roleIds) {
        Filter filter = filterFor(teamId, resource, resourceId, organizationMemberId, roleIds);
        return find(filter.query(), filter.parameters()).list();
    }

    /**
     * Grants on the resource that are team-wide, on the member, or on one of the roles. The member
     * and role branches are left out when there is nothing to match them against.
     */
    static Filter filterFor(
            UUID teamId,
            String resource,
            String resourceId,
            UUID organizationMemberId,
            Set<UUID> roleIds) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("teamId", teamId);
        parameters.put("resource", resource);
        parameters.put("resourceId", resourceId);

        StringBuilder scopes =
                new StringBuilder("(organizationMemberId IS NULL AND roleId IS NULL)");
        if (organizationMemberId != null) {
            scopes.append(" OR (organizationMemberId = :organizationMemberId AND roleId IS NULL)");
            parameters.put("organizationMemberId", organizationMemberId);
        }
        if (roleIds != null && !roleIds.isEmpty()) {
            scopes.append(" OR (organizationMemberId IS NULL AND roleId IN :roleIds)");
            parameters.put("roleIds", roleIds);
        }

        String query =
                "teamId = :teamId AND resource = :resource AND resourceId = :resourceId AND ("
                        + scopes
                        + ")";
        return new Filter(query, parameters);
    }
}
