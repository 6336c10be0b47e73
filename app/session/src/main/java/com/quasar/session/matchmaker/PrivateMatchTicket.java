package com.quasar.session.matchmaker;

import com.quasar.session.model.Match;

public record PrivateMatchTicket(Match match, String inviteCode, int slot) {}
