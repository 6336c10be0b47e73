package com.quasar.session.matchmaker;

import java.util.List;

public record QueueStats(int totalQueued, List<QueueSummary> queues, MatchmakerStats stats) {

  public QueueStats {
    queues = List.copyOf(queues);
  }
}
