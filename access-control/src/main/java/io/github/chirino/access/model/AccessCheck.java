package io.github.chirino.access.model;

/**
 * Outcome of an access check. {@link #UNRESTRICTED} means no access control applies to the
 * object, so the caller should rely on its other authorization layers.
 */
public enum AccessCheck {
    GRANTED,
    DENIED,
    UNRESTRICTED;

    public static AccessCheck of(boolean granted) {
        return granted ? GRANTED : DENIED;
    }

    public boolean isRestricted() {
        return this != UNRESTRICTED;
    }

    /** Collapses the result, using {@code whenUnrestricted} if no control applied. */
    public boolean isGranted(boolean whenUnrestricted) {
        return switch (this) {
            case GRANTED -> true;
            case DENIED -> false;
            case UNRESTRICTED -> whenUnrestricted;
        };
    }
}
