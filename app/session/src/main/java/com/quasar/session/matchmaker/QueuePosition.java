package com.quasar.session.matchmaker;

public record QueuePosition(String gameType, int position, int queueSize, long waitedMs) {}
