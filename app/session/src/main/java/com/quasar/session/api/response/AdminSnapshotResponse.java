package com.quasar.session.api.response;

import com.quasar.session.matchmaker.MatchmakerSnapshot;
import com.quasar.session.model.view.RegistrySnapshot;

public record AdminSnapshotResponse(RegistrySnapshot registry, MatchmakerSnapshot matchmaker) {}
