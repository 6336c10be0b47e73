package com.quasar.session.event;

/** Outbound side of the relay: hands an event envelope to the transport layer. */
public interface SessionEventPublisher {

  void publish(SessionEventMessage message);
}
