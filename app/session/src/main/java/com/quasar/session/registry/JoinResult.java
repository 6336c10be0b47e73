package com.quasar.session.registry;

import com.quasar.session.model.Match;
import com.quasar.session.model.PlayerSlot;

public record JoinResult(Match match, PlayerSlot player) {

  public int slot() {
    return player.slot();
  }
}
