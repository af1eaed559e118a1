package io.github.chirino.access.model;

import java.util.Optional;

/** Organization features that influence access control. */
public enum AvailableFeature {
    ROLE_BASED_ACCESS,
    PROJECT_BASED_PERMISSIONING,
    ADVANCED_PERMISSIONS;

    public String toValue() {
        return name().toLowerCase();
    }

    /** Parses a stored feature key; unknown keys yield empty. */
    public static Optional<AvailableFeature> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase();
        for (AvailableFeature feature : values()) {
            if (feature.name().equals(normalized)) {
                return Optional.of(feature);
            }
        }
        return Optional.empty();
    }
}
