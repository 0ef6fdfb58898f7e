package com.workq.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveWorkerRegistryTest {

    private final LiveWorkerRegistry registry = new LiveWorkerRegistry();

    @Test
    void shouldTrackWorkersByPid() {
        FakeWorkerHandle first = new FakeWorkerHandle(0, 10L, true);
        FakeWorkerHandle second = new FakeWorkerHandle(1, 11L, true);

        registry.register(first);
        registry.register(second);

        assertThat(registry.pids()).containsExactlyInAnyOrder(10L, 11L);
        assertThat(registry.list()).containsExactlyInAnyOrder(first, second);
    }

    @Test
    void shouldRejectSecondWorkerWithSamePid() {
        registry.register(new FakeWorkerHandle(0, 10L, true));

        assertThrows(IllegalStateException.class, () -> registry.register(new FakeWorkerHandle(1, 10L, true)));
    }

    @Test
    void shouldOnlyRemoveTheRegisteredHandle() {
        FakeWorkerHandle registered = new FakeWorkerHandle(0, 10L, true);
        registry.register(registered);

        assertFalse(registry.remove(new FakeWorkerHandle(0, 10L, true)));
        assertTrue(registry.remove(registered));
        assertFalse(registry.remove(registered));
        assertThat(registry.size()).isZero();
    }
}
