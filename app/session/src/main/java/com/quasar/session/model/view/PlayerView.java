package com.quasar.session.model.view;

public record PlayerView(
    int slot, String monogram, String name, boolean connected, boolean ready, int score) {}
