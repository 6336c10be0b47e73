package com.quasar.session.model.view;

import java.util.List;

public record RegistrySnapshot(RegistryStats stats, List<MatchView> matches) {

  public RegistrySnapshot {
    matches = List.copyOf(matches);
  }
}
