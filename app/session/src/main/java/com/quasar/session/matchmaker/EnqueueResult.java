package com.quasar.session.matchmaker;

import com.quasar.session.model.Match;

/**
 * Outcome of an enqueue. {@code position} is 1-based at the moment of queueing; {@code matched}
 * is set when the immediate pairing attempt already placed the player in a match.
 */
public record EnqueueResult(String gameType, int position, Match matched) {

  public boolean isMatched() {
    return matched != null;
  }
}
