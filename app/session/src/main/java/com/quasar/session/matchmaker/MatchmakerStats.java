package com.quasar.session.matchmaker;

public record MatchmakerStats(long queued, long matched, long timedOut, long cancelled) {}
