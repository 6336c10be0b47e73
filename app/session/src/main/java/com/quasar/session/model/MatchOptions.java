/*
 * どこで: Session ドメインモデル
 * 何を: Match 作成時の任意指定項目を保持する
 * なぜ: 未指定項目の既定値解決を MatchConfig 側へ集約するため
 */
package com.quasar.session.model;

/** Creation options; {@code null} fields fall back to {@link MatchConfig} defaults. */
public record MatchOptions(
    Integer minPlayers,
    Integer maxPlayers,
    Boolean publicMatch,
    Boolean joinable,
    Long timeoutMs,
    boolean privateMatch) {

  public static MatchOptions defaults() {
    return new MatchOptions(null, null, null, null, null, false);
  }

  public static MatchOptions sized(int minPlayers, int maxPlayers) {
    return new MatchOptions(minPlayers, maxPlayers, null, null, null, false);
  }

  public MatchOptions withTimeoutMs(long timeout) {
    return new MatchOptions(minPlayers, maxPlayers, publicMatch, joinable, timeout, privateMatch);
  }

  /** 非公開 + 招待コード付きの設定に切り替える。 */
  public MatchOptions asPrivate() {
    return new MatchOptions(minPlayers, maxPlayers, false, joinable, timeoutMs, true);
  }
}
