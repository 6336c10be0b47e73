/*
 * どこで: Session ドメインモデル
 * 何を: Match ごとの確定済み設定を表現する
 * なぜ: 作成後に変わらない設定値を不変オブジェクトとして共有するため
 */
package com.quasar.session.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MatchConfig(
    int minPlayers,
    int maxPlayers,
    @JsonProperty("public") boolean publicMatch,
    boolean joinable,
    long timeout,
    String inviteCode) {

  public static final int MAX_PLAYERS = 8;
  static final int DEFAULT_MIN_PLAYERS = 1;
  static final int DEFAULT_MAX_PLAYERS = 4;
  static final long DEFAULT_TIMEOUT_MS = 30_000L;

  /**
   * 役割: 作成オプションから確定設定を組み立てる。
   * 動作: 未指定項目は既定値（min=1, max=4, public/joinable=true, timeout=30s）で補い、max は 1..8 に丸める。
   * 前提: inviteCode は非公開 Match の場合のみ非 null を渡す。
   */
  public static MatchConfig resolve(MatchOptions options, String inviteCode) {
    final MatchOptions source = options == null ? MatchOptions.defaults() : options;
    final int min = positiveOr(source.minPlayers(), DEFAULT_MIN_PLAYERS);
    final int max = Math.min(positiveOr(source.maxPlayers(), DEFAULT_MAX_PLAYERS), MAX_PLAYERS);
    return new MatchConfig(
        min,
        max,
        source.publicMatch() == null || source.publicMatch(),
        source.joinable() == null || source.joinable(),
        source.timeoutMs() == null || source.timeoutMs() <= 0
            ? DEFAULT_TIMEOUT_MS
            : source.timeoutMs(),
        inviteCode);
  }

  /** 招待コードを除いた同一設定。公開向けの表示に使う。 */
  public MatchConfig withoutInviteCode() {
    return inviteCode == null
        ? this
        : new MatchConfig(minPlayers, maxPlayers, publicMatch, joinable, timeout, null);
  }

  private static int positiveOr(Integer value, int fallback) {
    return value == null || value <= 0 ? fallback : value;
  }
}
