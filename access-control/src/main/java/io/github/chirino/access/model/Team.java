package io.github.chirino.access.model;

import java.util.Objects;

/** A project inside an organization. Teams are access controlled as the {@code project} kind. */
public record Team(String id, String organizationId, String createdBy) implements AccessControlled {

    public static final String TYPE_NAME = "Team";

    public Team {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(organizationId, "organizationId");
    }

    public Team(String id, String organizationId) {
        this(id, organizationId, null);
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }
}
