package com.quasar.session.model.view;

public record FinalScore(int slot, String monogram, int score) {}
