package com.quasar.session.matchmaker;

import com.quasar.session.model.QueuedPlayer;
import java.util.List;
import java.util.Map;

public record MatchmakerSnapshot(
    boolean running, QueueStats queueStats, Map<String, List<QueuedPlayer>> queues) {

  public MatchmakerSnapshot {
    queues = Map.copyOf(queues);
  }
}
