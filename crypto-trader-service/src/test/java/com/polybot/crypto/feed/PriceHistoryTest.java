package com.polybot.crypto.feed;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for PriceHistory.
 */
class PriceHistoryTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final PriceHistory history = new PriceHistory(Duration.ofSeconds(1), Duration.ofMinutes(5), 300);

    @Test
    void throttlesSamplesWithinInterval() {
        assertThat(history.add(100, NOW)).isTrue();
        assertThat(history.add(101, NOW.plusMillis(500))).isFalse();
        assertThat(history.add(102, NOW.plusSeconds(1))).isTrue();

        assertThat(history.size()).isEqualTo(2);
    }

    @Test
    void prunesSamplesOlderThanRetention() {
        history.add(100, NOW);
        history.add(101, NOW.plusSeconds(60));
        history.add(102, NOW.plusSeconds(301));

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.oldest().price()).isEqualTo(101);
    }

    @Test
    void capsSampleCount() {
        PriceHistory small = new PriceHistory(Duration.ZERO, Duration.ofMinutes(5), 3);
        for (int i = 0; i < 5; i++) {
            small.add(100 + i, NOW.plusSeconds(i));
        }

        assertThat(small.size()).isEqualTo(3);
        assertThat(small.oldest().price()).isEqualTo(102);
    }

    @Test
    void changeOverUsesLastSampleAtOrBeforeWindowStart() {
        history.add(100, NOW);
        history.add(102, NOW.plusSeconds(30));
        history.add(104, NOW.plusSeconds(70));

        // window start is NOW+10s, so the reference is the sample at NOW
        double change = history.changeOver(Duration.ofMinutes(1), 105, NOW.plusSeconds(70));

        assertThat(change).isCloseTo(0.05, within(1e-9));
    }

    @Test
    void changeOverFallsBackToOldestSampleWhenHistoryIsShort() {
        history.add(100, NOW);
        history.add(101, NOW.plusSeconds(10));

        assertThat(history.changeOver(Duration.ofMinutes(5), 110, NOW.plusSeconds(10)))
                .isCloseTo(0.10, within(1e-9));
    }

    @Test
    void changeOverIsZeroWithoutSamples() {
        assertThat(history.changeOver(Duration.ofMinutes(1), 100, NOW)).isZero();
    }
}
