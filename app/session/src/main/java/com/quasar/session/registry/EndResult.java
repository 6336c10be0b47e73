package com.quasar.session.registry;

import com.quasar.session.model.Match;
import com.quasar.session.model.view.MatchEndSummary;

public record EndResult(Match match, MatchEndSummary summary) {}
