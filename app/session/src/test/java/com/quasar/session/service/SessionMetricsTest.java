package com.quasar.session.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SessionMetricsTest {

  @Test
  void updatesQueueMetricsAndCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SessionMetrics metrics = new SessionMetrics(registry);

    metrics.updateQueueDepth("pong", 3);
    metrics.updateOldestQueueAge("pong", 9);
    metrics.updateActiveMatches(12);
    metrics.recordMatchResult("matched");
    metrics.recordMatchResult("matched");
    metrics.recordHandlerError("joined");
    metrics.recordRelayError("ended");
    metrics.recordTimeToMatch(Duration.ofSeconds(5));

    assertThat(registry.get("mm.queue.depth").tag("game_type", "pong").gauge().value())
        .isEqualTo(3.0);
    assertThat(registry.get("mm.queue.oldest_age").tag("game_type", "pong").gauge().value())
        .isEqualTo(9.0);
    assertThat(registry.get("session.matches.active").gauge().value()).isEqualTo(12.0);
    assertThat(registry.get("mm.match.total").tag("result", "matched").counter().count())
        .isEqualTo(2.0);
    assertThat(
            registry
                .get("session.event.handler.error.total")
                .tag("event", "joined")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(registry.get("session.relay.error.total").tag("event", "ended").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("mm.time_to_match").timer().count()).isEqualTo(1L);
  }

  @Test
  void ignoresNegativeTimeToMatchAndClampsGauges() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SessionMetrics metrics = new SessionMetrics(registry);

    metrics.recordTimeToMatch(Duration.ofSeconds(-1));
    metrics.updateQueueDepth("pong", -4);

    assertThat(registry.get("mm.time_to_match").timer().count()).isZero();
    assertThat(registry.get("mm.queue.depth").tag("game_type", "pong").gauge().value()).isZero();
  }
}
