/*
 * どこで: Session 設定
 * 何を: tick 間隔・キュー待機上限・ゲーム種別設定を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.quasar.session.config;

import com.quasar.session.model.GameTypeConfig;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "session")
public record SessionProperties(
    Duration tickInterval,
    Duration maxQueueTime,
    Map<String, GameTypeProperties> gameTypes) {

  public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_QUEUE_TIME = Duration.ofMillis(120_000);

  public SessionProperties {
    tickInterval = tickInterval == null ? DEFAULT_TICK_INTERVAL : tickInterval;
    maxQueueTime = maxQueueTime == null ? DEFAULT_MAX_QUEUE_TIME : maxQueueTime;
    gameTypes = gameTypes == null ? Map.of() : Map.copyOf(gameTypes);
  }

  public static SessionProperties defaults() {
    return new SessionProperties(null, null, Map.of());
  }

  /**
   * 役割: 組み込み既定値へ設定ファイルの上書きを適用したゲーム種別設定を返す。
   * 動作: 既知の種別は未指定項目を既定値で補い、未知の種別は新規に追加する。
   * 前提: 上書き値は GameTypeConfig の妥当性条件を満たすこと（満たさなければ起動時に失敗する）。
   */
  public Map<String, GameTypeConfig> resolveGameTypes() {
    final Map<String, GameTypeConfig> resolved = new LinkedHashMap<>(GameTypeConfig.defaults());
    gameTypes.forEach(
        (name, override) -> resolved.put(name, override.applyTo(resolved.get(name))));
    return Collections.unmodifiableMap(resolved);
  }

  /** Partial override of one game type; {@code null} keeps the built-in value. */
  public record GameTypeProperties(
      Integer min, Integer max, Duration timeout, Boolean skillMatch) {

    GameTypeConfig applyTo(GameTypeConfig base) {
      final GameTypeConfig fallback = base == null ? GameTypeConfig.of(1, 4, false) : base;
      return new GameTypeConfig(
          min == null ? fallback.min() : min,
          max == null ? fallback.max() : max,
          timeout == null ? fallback.timeout() : timeout,
          skillMatch == null ? fallback.skillMatch() : skillMatch);
    }
  }
}
