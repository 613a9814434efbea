package com.example.changefeed.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReconnectBackoff Tests")
class ReconnectBackoffTest {

    @Test
    @DisplayName("Should double the delay per failure up to the cap")
    void shouldDoubleUpToCap() {
        ReconnectBackoff backoff = new ReconnectBackoff();

        List<Long> seconds = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            seconds.add(backoff.nextDelay().toSeconds());
        }

        assertThat(seconds).containsExactly(1L, 2L, 4L, 8L, 16L, 30L, 30L);
        assertThat(backoff.getConsecutiveFailures()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should start over after a reset")
    void shouldStartOverAfterReset() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofMillis(200), Duration.ofSeconds(5));
        backoff.nextDelay();
        backoff.nextDelay();

        backoff.reset();

        assertThat(backoff.nextDelay()).isEqualTo(Duration.ofMillis(200));
    }
}
