package io.github.chirino.access.model;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Orderings of access levels per resource kind. This is the only place that decides whether one
 * level is higher than another.
 */
public final class AccessLevels {

    public static final List<AccessLevel> MEMBER_BASED_ACCESS_LEVELS =
            List.of(AccessLevel.NONE, AccessLevel.MEMBER, AccessLevel.ADMIN);

    public static final List<AccessLevel> RESOURCE_BASED_ACCESS_LEVELS =
            List.of(AccessLevel.VIEWER, AccessLevel.EDITOR);

    private AccessLevels() {}

    /** Levels for the resource kind, lowest first. */
    public static List<AccessLevel> orderedAccessLevels(String resource) {
        return ResourceKinds.isMemberBased(resource)
                ? MEMBER_BASED_ACCESS_LEVELS
                : RESOURCE_BASED_ACCESS_LEVELS;
    }

    /** Level applied when no grant exists for an object of this kind. */
    public static AccessLevel defaultAccessLevel(String resource) {
        return ResourceKinds.isMemberBased(resource) ? AccessLevel.MEMBER : AccessLevel.EDITOR;
    }

    public static AccessLevel highestAccessLevel(String resource) {
        List<AccessLevel> levels = orderedAccessLevels(resource);
        return levels.get(levels.size() - 1);
    }

    public static boolean isValid(String resource, AccessLevel level) {
        return level != null && orderedAccessLevels(resource).contains(level);
    }

    /**
     * Position of {@code level} in the ordering of {@code resource}.
     *
     * @throws IllegalArgumentException if the level does not belong to the resource's ordering
     */
    public static int rank(String resource, AccessLevel level) {
        int index = orderedAccessLevels(resource).indexOf(level);
        if (index < 0) {
            throw new IllegalArgumentException(
                    "Access level " + level + " is not valid for resource " + resource);
        }
        return index;
    }

    public static boolean accessLevelSatisfied(
            String resource, AccessLevel current, AccessLevel required) {
        return rank(resource, current) >= rank(resource, required);
    }

    /** Returns an element with the highest level, any of them on ties. */
    public static <T> Optional<T> highest(
            String resource, Collection<T> items, Function<T, AccessLevel> levelOf) {
        T best = null;
        int bestRank = -1;
        for (T item : items) {
            int itemRank = rank(resource, levelOf.apply(item));
            if (itemRank > bestRank) {
                best = item;
                bestRank = itemRank;
            }
        }
        return Optional.ofNullable(best);
    }
}
