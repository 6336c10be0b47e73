package com.quasar.session.event;

/** Handle returned by {@link SessionEventBus#subscribe}. */
@FunctionalInterface
public interface Subscription {

  void unsubscribe();
}
