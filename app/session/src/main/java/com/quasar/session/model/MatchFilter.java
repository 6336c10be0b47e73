/*
 * どこで: Session ドメインモデル
 * 何を: Match 一覧取得時の絞り込み条件を表現する
 * なぜ: 任意条件の組み合わせを Registry へ 1 つの値で渡すため
 */
package com.quasar.session.model;

/**
 * {@code null} fields do not filter. {@code joinable} keeps only matches that can take a player
 * now; in-progress matches qualify only when {@code allowInProgress} is set.
 */
public record MatchFilter(
    String gameType,
    MatchState state,
    Boolean publicMatch,
    boolean joinable,
    boolean allowInProgress,
    boolean full) {

  public static MatchFilter all() {
    return new MatchFilter(null, null, null, false, false, false);
  }

  public static MatchFilter joinableOf(String gameType) {
    return new MatchFilter(gameType, null, null, true, false, false);
  }

  public boolean matches(Match match) {
    if (gameType != null && !gameType.equals(match.gameType())) {
      return false;
    }
    if (state != null && state != match.state()) {
      return false;
    }
    if (publicMatch != null && publicMatch != match.config().publicMatch()) {
      return false;
    }
    if (joinable) {
      return match.config().joinable()
          && !match.isFull()
          && (match.state() == MatchState.LOBBY
              || (allowInProgress && match.state() == MatchState.PLAYING));
    }
    return true;
  }
}
