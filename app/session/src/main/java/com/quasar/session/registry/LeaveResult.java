package com.quasar.session.registry;

import com.quasar.session.model.Match;

/** {@code matchEnded} is set when the departure emptied the match and it was torn down. */
public record LeaveResult(Match match, String playerId, int slot, boolean matchEnded) {}
