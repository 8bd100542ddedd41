package com.airforecast.service;

import com.airforecast.model.RetrainSignal;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class RetrainSignalRegistryTest {

    private final RetrainSignalRegistry registry = new RetrainSignalRegistry();

    @Test
    void signal_isConsumedExactlyOnce() {
        registry.raise(signal("zhaoqing", "coverage"));

        assertThat(registry.pendingCities()).containsExactly("zhaoqing");
        assertThat(registry.consume("zhaoqing")).map(RetrainSignal::reason).contains("coverage");
        assertThat(registry.consume("zhaoqing")).isEmpty();
        assertThat(registry.pendingCities()).isEmpty();
    }

    @Test
    void restore_doesNotOverwriteNewerSignal() {
        RetrainSignal old = signal("zhaoqing", "old");
        registry.raise(old);
        registry.consume("zhaoqing");
        registry.raise(signal("zhaoqing", "new"));

        registry.restore(old);

        assertThat(registry.peek("zhaoqing")).map(RetrainSignal::reason).contains("new");
    }

    private static RetrainSignal signal(String city, String reason) {
        return new RetrainSignal(city, reason, 0.7, 9.0, 48, Instant.parse("2025-05-01T00:00:00Z"));
    }
}
