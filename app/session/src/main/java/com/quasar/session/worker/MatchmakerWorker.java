package com.quasar.session.worker;

import com.quasar.session.matchmaker.Matchmaker;
import com.quasar.session.matchmaker.QueueStats;
import com.quasar.session.matchmaker.QueueSummary;
import com.quasar.session.service.SessionMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "session.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MatchmakerWorker {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakerWorker.class);

  private final Matchmaker matchmaker;
  private final SessionMetrics metrics;

  public MatchmakerWorker(Matchmaker matchmaker, SessionMetrics metrics) {
    this.matchmaker = matchmaker;
    this.metrics = metrics;
  }

  @PostConstruct
  public void start() {
    matchmaker.start();
  }

  @PreDestroy
  public void stop() {
    matchmaker.stop();
  }

  @Scheduled(fixedDelayString = "${session.tick-interval:1s}")
  public void run() {
    try {
      final int formed = matchmaker.tick();
      if (formed > 0) {
        logger.debug("matchmaker tick formed={}", formed);
      }
    } catch (RuntimeException ex) {
      logger.warn("matchmaker worker tick failed", ex);
      metrics.recordMatchResult("worker_error");
    }
    publishQueueGauges();
  }

  private void publishQueueGauges() {
    try {
      final QueueStats stats = matchmaker.getQueueStats();
      for (QueueSummary queue : stats.queues()) {
        metrics.updateQueueDepth(queue.gameType(), queue.size());
        metrics.updateOldestQueueAge(queue.gameType(), queue.oldestWaitMs() / 1000);
      }
    } catch (RuntimeException ex) {
      logger.warn("queue gauge update failed", ex);
    }
  }
}
