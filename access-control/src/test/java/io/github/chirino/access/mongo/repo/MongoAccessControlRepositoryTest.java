package io.github.chirino.access.mongo.repo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

class MongoAccessControlRepositoryTest {

    private static BsonArray scopes(String memberId, Set<String> roleIds) {
        BsonDocument filter =
                MongoAccessControlRepository.scopeFilter(memberId, roleIds).toBsonDocument();
        return filter.getArray("$or");
    }

    @Test
    void team_wide_only_without_member_or_roles() {
        BsonArray scopes = scopes(null, Set.of());

        assertEquals(1, scopes.size());
        String json = scopes.toString();
        assertFalse(json.contains("$in"));
    }

    @Test
    void member_branch_is_added_for_members() {
        BsonArray scopes = scopes("member-1", null);

        assertEquals(2, scopes.size());
        assertTrue(scopes.get(1).toString().contains("member-1"));
        assertFalse(scopes.toString().contains("$in"));
    }

    @Test
    void role_branch_is_added_only_with_roles() {
        BsonArray scopes = scopes("member-1", Set.of("role-a"));

        assertEquals(3, scopes.size());
        String roleBranch = scopes.get(2).toString();
        assertTrue(roleBranch.contains("$in"));
        assertTrue(roleBranch.contains("role-a"));
    }
}
