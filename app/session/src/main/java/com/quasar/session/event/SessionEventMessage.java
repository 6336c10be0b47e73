/*
 * どこで: Session イベント
 * 何を: 配信レイヤーへ送るイベントエンベロープを定義する
 * なぜ: NATS 上のメッセージ形状を Java 側の型で固定するため
 */
package com.quasar.session.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionEventMessage(
    String eventId,
    String eventType,
    String occurredAt,
    String matchId,
    String playerId,
    String traceId,
    Object payload) {}
