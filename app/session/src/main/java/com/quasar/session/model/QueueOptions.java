/*
 * どこで: Session ドメインモデル
 * 何を: enqueue / private match 時の任意プレイヤー情報を保持する
 * なぜ: 表示名やスキル値の未指定を 1 か所で扱うため
 */
package com.quasar.session.model;

import java.util.Map;

public record QueueOptions(
    String monogram, String name, Double skill, Map<String, Object> preferences) {

  public static QueueOptions none() {
    return new QueueOptions(null, null, null, Map.of());
  }

  public static QueueOptions of(String monogram, String name) {
    return new QueueOptions(monogram, name, null, Map.of());
  }

  public static QueueOptions withSkill(String monogram, double skill) {
    return new QueueOptions(monogram, null, skill, Map.of());
  }

  public double skillOrDefault() {
    return skill == null ? QueuedPlayer.DEFAULT_SKILL : skill;
  }
}
