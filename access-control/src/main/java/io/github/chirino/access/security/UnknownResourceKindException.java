package io.github.chirino.access.security;

/** Thrown when an object's type name does not map to a registered resource kind. */
public class UnknownResourceKindException extends RuntimeException {

    private final String typeName;

    public UnknownResourceKindException(String typeName) {
        super("Type " + typeName + " does not have a corresponding resource kind");
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
