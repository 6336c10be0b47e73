/*
 * どこで: Session ドメインモデル
 * 何を: キュー待機中のプレイヤーを表現する
 * なぜ: Matchmaker 内の待機情報を不変値として扱うため
 */
package com.quasar.session.model;

import java.time.Instant;
import java.util.Map;

public record QueuedPlayer(
    String playerId,
    String gameType,
    String monogram,
    String name,
    double skill,
    Instant joinedAt,
    Map<String, Object> preferences) {

  public static final double DEFAULT_SKILL = 1000;

  public QueuedPlayer {
    preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
  }
}
