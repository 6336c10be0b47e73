package com.quasar.session.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quasar.session.config.SessionNatsProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JetStream / ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NatsSessionEventPublisher implements SessionEventPublisher {

  private final JetStream jetStream;
  private final SessionNatsProperties properties;
  private final ObjectMapper objectMapper;

  public NatsSessionEventPublisher(
      JetStream jetStream, SessionNatsProperties properties, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(SessionEventMessage message) {
    if (message == null || message.eventId() == null || message.eventId().isBlank()) {
      throw new IllegalArgumentException("eventId is required");
    }
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize session event", ex);
    }
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", message.eventId());
    try {
      jetStream.publish(properties.subjectFor(message.eventType()), headers, body);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish session event", ex);
    }
  }
}
