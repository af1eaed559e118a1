package io.github.chirino.access.persistence.repo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AccessControlRepositoryTest {

    private static final UUID TEAM = UUID.randomUUID();

    @Test
    void team_wide_only_without_member_or_roles() {
        AccessControlRepository.Filter filter =
                AccessControlRepository.filterFor(TEAM, "dashboard", "42", null, Set.of());

        assertEquals(
                "teamId = :teamId AND resource = :resource AND resourceId = :resourceId AND"
                        + " ((organizationMemberId IS NULL AND roleId IS NULL))",
                filter.query());
        assertEquals(3, filter.parameters().size());
        assertEquals(TEAM, filter.parameters().get("teamId"));
        assertEquals("dashboard", filter.parameters().get("resource"));
        assertEquals("42", filter.parameters().get("resourceId"));
    }

    @Test
    void member_branch_is_added_for_members() {
        UUID member = UUID.randomUUID();
        AccessControlRepository.Filter filter =
                AccessControlRepository.filterFor(TEAM, "dashboard", "42", member, null);

        assertTrue(
                filter.query()
                        .contains(
                                "OR (organizationMemberId = :organizationMemberId AND roleId IS"
                                        + " NULL)"));
        assertFalse(filter.query().contains(":roleIds"));
        assertEquals(member, filter.parameters().get("organizationMemberId"));
    }

    @Test
    void role_branch_is_added_only_with_roles() {
        UUID member = UUID.randomUUID();
        Set<UUID> roles = Set.of(UUID.randomUUID(), UUID.randomUUID());
        AccessControlRepository.Filter filter =
                AccessControlRepository.filterFor(TEAM, "insight", "7", member, roles);

        assertTrue(
                filter.query()
                        .contains("OR (organizationMemberId IS NULL AND roleId IN :roleIds)"));
        assertEquals(roles, filter.parameters().get("roleIds"));
        assertEquals(5, filter.parameters().size());
    }
}
