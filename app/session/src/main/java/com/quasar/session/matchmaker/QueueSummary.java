/*
 * どこで: Matchmaker ビュー
 * 何を: ゲーム種別ごとのキュー状況を表現する
 * なぜ: 管理 API と worker のメトリクス更新で同じ集計を使うため
 */
package com.quasar.session.matchmaker;

public record QueueSummary(
    String gameType, int size, long oldestWaitMs, int min, int max, boolean skillMatch) {}
