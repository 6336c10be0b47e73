package com.quasar.session.model.view;

/** Most recent input seen by a match, kept under {@code game.lastInput}. */
public record LastInput(String playerId, Object input, long ts) {}
