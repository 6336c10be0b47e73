/*
 * どこで: Session ビューモデル
 * 何を: Match 終了時の結果を表現する
 * なぜ: ended イベントと API 応答で同じ集計を使うため
 */
package com.quasar.session.model.view;

import java.util.List;

public record MatchEndSummary(String reason, long duration, List<FinalScore> players) {

  public MatchEndSummary {
    players = List.copyOf(players);
  }
}
