package com.quasar.session.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SessionMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer timeToMatchTimer;
  private final AtomicLong activeMatches = new AtomicLong(0);
  private final ConcurrentMap<String, AtomicLong> queueDepth = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> oldestAge = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> matchResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> handlerErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> relayErrorCounters = new ConcurrentHashMap<>();

  public SessionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.timeToMatchTimer =
        Timer.builder("mm.time_to_match")
            .description("Time from enqueue to match formation")
            .register(meterRegistry);
    Gauge.builder("session.matches.active", activeMatches, AtomicLong::get)
        .description("Matches currently occupying a registry slot")
        .register(meterRegistry);
  }

  public void updateQueueDepth(String gameType, long depth) {
    final AtomicLong value = queueDepth.computeIfAbsent(gameType, this::registerQueueDepthGauge);
    value.set(Math.max(0, depth));
  }

  public void updateOldestQueueAge(String gameType, long ageSeconds) {
    final AtomicLong value = oldestAge.computeIfAbsent(gameType, this::registerOldestAgeGauge);
    value.set(Math.max(0, ageSeconds));
  }

  public void updateActiveMatches(long count) {
    activeMatches.set(Math.max(0, count));
  }

  /** result: matched / timeout / cancelled / no_slots */
  public void recordMatchResult(String result) {
    matchResultCounters.computeIfAbsent(result, this::registerMatchResultCounter).increment();
  }

  public void recordTimeToMatch(Duration waited) {
    if (waited == null || waited.isNegative()) {
      return;
    }
    timeToMatchTimer.record(waited);
  }

  public void recordHandlerError(String eventType) {
    handlerErrorCounters
        .computeIfAbsent(
            eventType,
            type ->
                Counter.builder("session.event.handler.error.total")
                    .tags(Tags.of("event", type))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRelayError(String eventType) {
    relayErrorCounters
        .computeIfAbsent(
            eventType,
            type ->
                Counter.builder("session.relay.error.total")
                    .tags(Tags.of("event", type))
                    .register(meterRegistry))
        .increment();
  }

  private AtomicLong registerQueueDepthGauge(String gameType) {
    final AtomicLong value = new AtomicLong(0);
    Gauge.builder("mm.queue.depth", value, AtomicLong::get)
        .tags(Tags.of("game_type", gameType))
        .register(meterRegistry);
    return value;
  }

  private AtomicLong registerOldestAgeGauge(String gameType) {
    final AtomicLong value = new AtomicLong(0);
    Gauge.builder("mm.queue.oldest_age", value, AtomicLong::get)
        .tags(Tags.of("game_type", gameType))
        .register(meterRegistry);
    return value;
  }

  private Counter registerMatchResultCounter(String result) {
    return Counter.builder("mm.match.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }
}
