package com.quasar.session.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.quasar.session.model.view.MatchView;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JoinResponse(String matchId, int slot, MatchView match) {}
