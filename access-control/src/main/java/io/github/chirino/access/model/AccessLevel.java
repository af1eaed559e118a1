package io.github.chirino.access.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Access levels used by grants. Member-based kinds use {@code none/member/admin}, every other
 * resource kind uses {@code viewer/editor}. The declaration order carries no meaning: compare
 * levels only through {@code AccessLevels.orderedAccessLevels(resource)}.
 */
public enum AccessLevel {
    NONE,
    MEMBER,
    ADMIN,
    VIEWER,
    EDITOR;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AccessLevel fromString(String value) {
        if (value == null) {
            return null;
        }
        return AccessLevel.valueOf(value.trim().toUpperCase());
    }

    /** Lenient lookup for stored values; unknown names are empty. */
    public static Optional<AccessLevel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String name = value.trim().toUpperCase();
        for (AccessLevel level : values()) {
            if (level.name().equals(name)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
