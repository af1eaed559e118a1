package io.github.chirino.access.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AccessControlTest {

    @Test
    void rejects_level_not_valid_for_resource() {
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        new AccessControl(
                                "ac1", "t1", "dashboard", "1", null, null, AccessLevel.ADMIN));
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        new AccessControl(
                                "ac1", "t1", "project", "1", null, null, AccessLevel.EDITOR));
    }

    @Test
    void rejects_member_and_role_together() {
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        new AccessControl(
                                "ac1", "t1", "dashboard", "1", "m1", "r1", AccessLevel.VIEWER));
    }

    @Test
    void virtual_controls_have_no_id() {
        AccessControl control = AccessControl.virtual("t1", "project", "t1", AccessLevel.ADMIN);
        assertTrue(control.isVirtual());
        assertTrue(control.isTeamWide());
        assertEquals(AccessLevel.ADMIN, control.accessLevel());
    }

    @Test
    void query_without_member_or_roles() {
        AccessControlQuery query = new AccessControlQuery("t1", "dashboard", "42", null, null);

        assertFalse(query.includesMember());
        assertFalse(query.includesRoles());
        assertTrue(query.roleIds().isEmpty());
    }
}
