package com.quasar.session.event;

import java.time.Instant;

public record SessionEvent(SessionEventType type, Instant occurredAt, SessionEventPayload payload) {

  /**
   * 役割: ペイロードを期待型で取り出す。
   * 動作: 型が一致しない場合は IllegalStateException を送出する。
   * 前提: 購読したイベント種別に対応する型を指定すること。
   */
  public <T extends SessionEventPayload> T payloadAs(Class<T> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "event " + this.type.value() + " carries " + payload.getClass().getSimpleName());
    }
    return type.cast(payload);
  }
}
