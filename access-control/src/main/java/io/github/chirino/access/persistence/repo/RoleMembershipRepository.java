package io.github.chirino.access.persistence.repo;

import io.github.chirino.access.persistence.entity.RoleMembershipEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class RoleMembershipRepository implements PanacheRepositoryBase<RoleMembershipEntity, UUID> {

    @Inject EntityManager entityManager;

    public List<UUID> listRoleIdsForUser(String userId) {
        return entityManager
                .createQuery(
                        "select distinct r.roleId from RoleMembershipEntity r where r.userId ="
                                + " :userId",
                        UUID.class)
                .setParameter("userId", userId)
                .getResultList();
    }
}
