package io.tick4j.config;

import io.tick4j.runtime.TenantRuntimes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Tick4jLifecycleTest {

    private final TenantRuntimes runtimes = mock(TenantRuntimes.class);
    private final Tick4jLifecycle lifecycle = new Tick4jLifecycle(runtimes);

    @Test
    void startShouldRestoreTriggersAndStopShouldRetireThem() {
        when(runtimes.restoreTriggers()).thenReturn(2);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();
        verify(runtimes).shutdown();
    }

    @Test
    void failedRestoreShouldLeaveLifecycleStopped() {
        when(runtimes.restoreTriggers()).thenThrow(new IllegalStateException("state store unreachable"));

        assertThatThrownBy(lifecycle::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("state store unreachable");
        assertThat(lifecycle.isRunning()).isFalse();

        lifecycle.stop();
        verify(runtimes, never()).shutdown();
    }
}
