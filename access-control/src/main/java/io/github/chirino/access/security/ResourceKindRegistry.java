package io.github.chirino.access.security;

import io.github.chirino.access.model.AccessControlled;
import io.github.chirino.access.model.ResourceKinds;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Maps access-controlled objects to resource kinds. Type names are lower-cased, {@code team} and
 * {@code featureflag} are renamed, and everything else must be a registered kind.
 */
@ApplicationScoped
public class ResourceKindRegistry {

    @ConfigProperty(name = "access-control.resource-kinds")
    Optional<List<String>> configuredKinds;

    private Set<String> kinds;

    public ResourceKindRegistry() {}

    ResourceKindRegistry(List<String> kinds) {
        this.configuredKinds = Optional.ofNullable(kinds);
        init();
    }

    @PostConstruct
    void init() {
        List<String> source =
                configuredKinds != null && configuredKinds.isPresent()
                        ? configuredKinds.get()
                        : ResourceKinds.DEFAULTS;
        Set<String> normalized = new LinkedHashSet<>();
        for (String kind : source) {
            if (kind != null && !kind.isBlank()) {
                normalized.add(kind.trim().toLowerCase(Locale.ROOT));
            }
        }
        normalized.add(ResourceKinds.PROJECT);
        normalized.add(ResourceKinds.ORGANIZATION);
        kinds = Set.copyOf(normalized);
    }

    public Set<String> getKinds() {
        return kinds;
    }

    public boolean isRegistered(String resource) {
        return resource != null && kinds.contains(resource);
    }

    public String resourceKindOf(AccessControlled object) {
        return resourceKindOf(object.typeName());
    }

    public String resourceKindOf(String typeName) {
        String name = typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);
        if ("team".equals(name)) {
            return ResourceKinds.PROJECT;
        }
        if ("featureflag".equals(name)) {
            return ResourceKinds.FEATURE_FLAG;
        }
        if (!kinds.contains(name)) {
            throw new UnknownResourceKindException(typeName);
        }
        return name;
    }
}
