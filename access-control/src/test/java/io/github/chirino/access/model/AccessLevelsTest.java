package io.github.chirino.access.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AccessLevelsTest {

    @Test
    void member_based_kinds_use_none_member_admin() {
        for (String resource : List.of(ResourceKinds.PROJECT, ResourceKinds.ORGANIZATION)) {
            assertEquals(
                    List.of(AccessLevel.NONE, AccessLevel.MEMBER, AccessLevel.ADMIN),
                    AccessLevels.orderedAccessLevels(resource));
        }
    }

    @Test
    void other_kinds_use_viewer_editor() {
        for (String resource : List.of("dashboard", "feature_flag", "insight", "notebook")) {
            assertEquals(
                    List.of(AccessLevel.VIEWER, AccessLevel.EDITOR),
                    AccessLevels.orderedAccessLevels(resource));
        }
    }

    @Test
    void default_levels() {
        assertEquals(AccessLevel.MEMBER, AccessLevels.defaultAccessLevel("project"));
        assertEquals(AccessLevel.MEMBER, AccessLevels.defaultAccessLevel("organization"));
        assertEquals(AccessLevel.EDITOR, AccessLevels.defaultAccessLevel("dashboard"));
        assertEquals(AccessLevel.EDITOR, AccessLevels.defaultAccessLevel("feature_flag"));
    }

    @Test
    void highest_levels() {
        assertEquals(AccessLevel.ADMIN, AccessLevels.highestAccessLevel("project"));
        assertEquals(AccessLevel.EDITOR, AccessLevels.highestAccessLevel("insight"));
    }

    @Test
    void satisfied_is_reflexive() {
        for (AccessLevel level : AccessLevels.MEMBER_BASED_ACCESS_LEVELS) {
            assertTrue(AccessLevels.accessLevelSatisfied("project", level, level));
        }
        for (AccessLevel level : AccessLevels.RESOURCE_BASED_ACCESS_LEVELS) {
            assertTrue(AccessLevels.accessLevelSatisfied("dashboard", level, level));
        }
    }

    @Test
    void satisfied_follows_the_ordering() {
        assertTrue(
                AccessLevels.accessLevelSatisfied(
                        "project", AccessLevel.ADMIN, AccessLevel.MEMBER));
        assertFalse(
                AccessLevels.accessLevelSatisfied(
                        "project", AccessLevel.MEMBER, AccessLevel.ADMIN));
        assertFalse(
                AccessLevels.accessLevelSatisfied("project", AccessLevel.NONE, AccessLevel.MEMBER));
        assertTrue(
                AccessLevels.accessLevelSatisfied(
                        "dashboard", AccessLevel.EDITOR, AccessLevel.VIEWER));
        assertFalse(
                AccessLevels.accessLevelSatisfied(
                        "dashboard", AccessLevel.VIEWER, AccessLevel.EDITOR));
    }

    @Test
    void satisfied_is_transitive() {
        List<AccessLevel> levels = AccessLevels.MEMBER_BASED_ACCESS_LEVELS;
        for (AccessLevel a : levels) {
            for (AccessLevel b : levels) {
                for (AccessLevel c : levels) {
                    if (AccessLevels.accessLevelSatisfied("project", a, b)
                            && AccessLevels.accessLevelSatisfied("project", b, c)) {
                        assertTrue(AccessLevels.accessLevelSatisfied("project", a, c));
                    }
                }
            }
        }
    }

    @Test
    void level_outside_the_ordering_is_rejected() {
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        AccessLevels.accessLevelSatisfied(
                                "dashboard", AccessLevel.ADMIN, AccessLevel.VIEWER));
        assertThrows(
                IllegalArgumentException.class,
                () -> AccessLevels.rank("project", AccessLevel.EDITOR));
    }

    @Test
    void highest_picks_the_maximum() {
        List<AccessLevel> levels =
                List.of(AccessLevel.VIEWER, AccessLevel.EDITOR, AccessLevel.VIEWER);
        assertEquals(
                AccessLevel.EDITOR,
                AccessLevels.highest("dashboard", levels, level -> level).orElseThrow());
        assertTrue(AccessLevels.highest("dashboard", List.<AccessLevel>of(), l -> l).isEmpty());
    }

    @Test
    void access_level_round_trips_lower_case_values() {
        assertEquals("editor", AccessLevel.EDITOR.toValue());
        assertEquals(AccessLevel.VIEWER, AccessLevel.fromString("viewer"));
        assertNull(AccessLevel.fromString(null));
        assertEquals(Optional.of(AccessLevel.EDITOR), AccessLevel.fromValue(" Editor "));
        assertTrue(AccessLevel.fromValue("owner").isEmpty());
        assertTrue(AccessLevel.fromValue(null).isEmpty());
    }
}
