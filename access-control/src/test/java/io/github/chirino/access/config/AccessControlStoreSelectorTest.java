package io.github.chirino.access.config;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.access.store.AccessControlStore;
import io.github.chirino.access.store.MeteredAccessControlStore;
import io.github.chirino.access.store.impl.MongoAccessControlStore;
import io.github.chirino.access.store.impl.PostgresAccessControlStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccessControlStoreSelectorTest {

    private Instance<PostgresAccessControlStore> postgresStore;
    private Instance<MongoAccessControlStore> mongoStore;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        postgresStore = mock(Instance.class);
        when(postgresStore.get()).thenReturn(new PostgresAccessControlStore());
        mongoStore = mock(Instance.class);
        when(mongoStore.get()).thenReturn(new MongoAccessControlStore());
    }

    private AccessControlStoreSelector createSelector(String type) {
        AccessControlStoreSelector selector = new AccessControlStoreSelector();
        selector.datastoreType = type;
        selector.postgresStore = postgresStore;
        selector.mongoStore = mongoStore;
        selector.meterRegistry = new SimpleMeterRegistry();
        selector.init();
        return selector;
    }

    private static AccessControlStore delegateOf(AccessControlStoreSelector selector) {
        MeteredAccessControlStore metered =
                assertInstanceOf(MeteredAccessControlStore.class, selector.getStore());
        return metered.getDelegate();
    }

    @Test
    void defaults_to_postgres() {
        assertInstanceOf(PostgresAccessControlStore.class, delegateOf(createSelector("postgres")));
        verify(mongoStore, never()).get();
    }

    @Test
    void defaults_to_postgres_when_null() {
        assertInstanceOf(PostgresAccessControlStore.class, delegateOf(createSelector(null)));
    }

    @Test
    void selects_mongo() {
        assertInstanceOf(MongoAccessControlStore.class, delegateOf(createSelector("mongo")));
        assertInstanceOf(MongoAccessControlStore.class, delegateOf(createSelector(" MongoDB ")));
    }

    @Test
    void unknown_type_fails_fast() {
        IllegalStateException e =
                assertThrows(IllegalStateException.class, () -> createSelector("cassandra"));
        assertTrue(e.getMessage().contains("cassandra"));
        verify(postgresStore, never()).get();
    }
}
