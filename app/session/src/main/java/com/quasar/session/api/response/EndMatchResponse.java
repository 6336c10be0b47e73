package com.quasar.session.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.quasar.session.model.view.MatchEndSummary;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EndMatchResponse(String matchId, MatchEndSummary result) {}
