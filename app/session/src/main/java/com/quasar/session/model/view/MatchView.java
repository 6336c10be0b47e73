package com.quasar.session.model.view;

/** Wire representation of a match, compact or full. */
public interface MatchView {

  String id();
}
