package io.github.chirino.access.config;

import io.github.chirino.access.store.AccessControlStore;
import io.github.chirino.access.store.MeteredAccessControlStore;
import io.github.chirino.access.store.impl.MongoAccessControlStore;
import io.github.chirino.access.store.impl.PostgresAccessControlStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/** Picks the datastore named by {@code access-control.datastore.type} and adds store metrics. */
@ApplicationScoped
public class AccessControlStoreSelector {

    private static final Logger LOG = Logger.getLogger(AccessControlStoreSelector.class);

    @ConfigProperty(name = "access-control.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject Instance<PostgresAccessControlStore> postgresStore;

    @Inject Instance<MongoAccessControlStore> mongoStore;

    @Inject MeterRegistry meterRegistry;

    private AccessControlStore meteredStore;

    @PostConstruct
    void init() {
        meteredStore = new MeteredAccessControlStore(meterRegistry, selectDelegate());
    }

    public AccessControlStore getStore() {
        return meteredStore;
    }

    private AccessControlStore selectDelegate() {
        String type = datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase();
        if ("postgres".equals(type)) {
            LOG.info("Resolving access controls from PostgreSQL");
            return postgresStore.get();
        }
        if ("mongo".equals(type) || "mongodb".equals(type)) {
            LOG.info("Resolving access controls from MongoDB");
            return mongoStore.get();
        }
        throw new IllegalStateException(
                "Unsupported access-control.datastore.type: " + datastoreType);
    }
}
