/*
 * どこで: Session ビューモデル
 * 何を: Registry の稼働状況集計を定義する
 * なぜ: 管理 API とメトリクスで同じ集計値を参照するため
 */
package com.quasar.session.model.view;

import java.util.Map;

public record RegistryStats(
    int total,
    int active,
    int available,
    int players,
    Map<String, Integer> byState,
    Map<String, Integer> byGameType,
    long created,
    long ended,
    int peakActive) {

  public RegistryStats {
    byState = Map.copyOf(byState);
    byGameType = Map.copyOf(byGameType);
  }
}
