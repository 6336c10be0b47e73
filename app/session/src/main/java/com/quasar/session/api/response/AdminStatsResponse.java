/*
 * どこで: Session 管理 API レスポンス DTO
 * 何を: Registry と Matchmaker の集計をまとめて返す
 * なぜ: 運用時の状況確認を 1 リクエストで済ませるため
 */
package com.quasar.session.api.response;

import com.quasar.session.matchmaker.QueueStats;
import com.quasar.session.model.view.RegistryStats;

public record AdminStatsResponse(RegistryStats registry, QueueStats matchmaker) {}
