package io.github.chirino.access.model;

/**
 * An object that access-control grants can point at. Each domain type declares its own type name
 * (e.g. {@code "Dashboard"}, {@code "FeatureFlag"}), which the resource-kind registry maps to a
 * resource kind.
 */
public interface AccessControlled {

    String typeName();

    /** Identifier of the object; grants store it as a string. */
    Object id();

    /** User id of the creator, or {@code null} when unknown. */
    default String createdBy() {
        return null;
    }
}
