package com.phillippitts.radflow.service.queue;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalAccessGateTest {

    @Test
    void tryEnterFailsFromAnotherThreadWhileHeld() throws Exception {
        // Arrange
        ExternalAccessGate gate = new ExternalAccessGate();
        gate.enter();

        // Act
        boolean acquired = CompletableFuture.supplyAsync(gate::tryEnter).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(acquired).isFalse();
        assertThat(gate.isHeld()).isTrue();
        gate.exit();
        assertThat(gate.isHeld()).isFalse();
    }

    @Test
    void tryEnterSucceedsWhenFree() throws Exception {
        // Arrange
        ExternalAccessGate gate = new ExternalAccessGate();

        // Act
        boolean acquired = CompletableFuture.supplyAsync(() -> {
            boolean ok = gate.tryEnter();
            if (ok) {
                gate.exit();
            }
            return ok;
        }).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(acquired).isTrue();
    }
}
