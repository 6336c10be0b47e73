/*
 * どこで: Session ドメインモデル
 * 何を: ゲーム種別ごとのマッチメイク設定を表現する
 * なぜ: 人数レンジとスキルマッチ有無を種別単位で切り替えるため
 */
package com.quasar.session.model;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public record GameTypeConfig(int min, int max, Duration timeout, boolean skillMatch) {

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  public GameTypeConfig {
    if (min < 1 || max < min || max > MatchConfig.MAX_PLAYERS) {
      throw new IllegalArgumentException("invalid player range min=" + min + " max=" + max);
    }
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
  }

  public static GameTypeConfig of(int min, int max, boolean skillMatch) {
    return new GameTypeConfig(min, max, DEFAULT_TIMEOUT, skillMatch);
  }

  /** 役割: 組み込みのゲーム種別設定を登録順で返す。 */
  public static Map<String, GameTypeConfig> defaults() {
    final Map<String, GameTypeConfig> configs = new LinkedHashMap<>();
    configs.put("quadrapole", of(1, 4, false));
    configs.put("trax", of(1, 8, false));
    configs.put("formant", of(1, 8, false));
    configs.put("magnetar", of(1, 2, true));
    configs.put("pong", of(1, 2, true));
    return configs;
  }

  /** この種別用の公開 Match 作成オプション。 */
  public MatchOptions matchOptions() {
    return MatchOptions.sized(min, max).withTimeoutMs(timeout.toMillis());
  }
}
