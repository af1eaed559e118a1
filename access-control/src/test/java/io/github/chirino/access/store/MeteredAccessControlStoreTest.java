package io.github.chirino.access.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.chirino.access.model.AccessControl;
import io.github.chirino.access.model.AccessControlQuery;
import io.github.chirino.access.model.AccessLevel;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MeteredAccessControlStoreTest {

    @Test
    void records_a_timer_per_operation() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AccessControlStore delegate = mock(AccessControlStore.class);
        AccessControlQuery query = new AccessControlQuery("t1", "insight", "9", "m1", Set.of());
        AccessControl grant =
                new AccessControl("ac1", "t1", "insight", "9", null, null, AccessLevel.VIEWER);
        when(delegate.findAccessControls(query)).thenReturn(List.of(grant));
        when(delegate.findOrganizationMembership("o1", "u1")).thenReturn(Optional.empty());

        MeteredAccessControlStore store = new MeteredAccessControlStore(registry, delegate);

        assertEquals(List.of(grant), store.findAccessControls(query));
        assertEquals(List.of(grant), store.findAccessControls(query));
        assertEquals(Optional.empty(), store.findOrganizationMembership("o1", "u1"));

        Timer find =
                registry.get(MeteredAccessControlStore.METRIC_NAME)
                        .tag("operation", "findAccessControls")
                        .timer();
        assertEquals(2, find.count());
        Timer membership =
                registry.get(MeteredAccessControlStore.METRIC_NAME)
                        .tag("operation", "findOrganizationMembership")
                        .timer();
        assertEquals(1, membership.count());
    }

    @Test
    void delegate_failures_are_not_wrapped() {
        AccessControlStore delegate = mock(AccessControlStore.class);
        when(delegate.findRoleIds("u1")).thenThrow(new IllegalStateException("boom"));

        MeteredAccessControlStore store =
                new MeteredAccessControlStore(new SimpleMeterRegistry(), delegate);

        IllegalStateException e =
                assertThrows(IllegalStateException.class, () -> store.findRoleIds("u1"));
        assertEquals("boom", e.getMessage());
    }
}
