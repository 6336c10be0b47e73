/*
 * どこで: Session ビューモデル
 * 何を: 一覧表示用の Match 要約を定義する
 * なぜ: 既存クライアントが参照するフィールド名を固定するため
 */
package com.quasar.session.model.view;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.quasar.session.model.MatchState;

@JsonPropertyOrder({
  "id", "gameType", "state", "players", "maxPlayers", "public", "joinable", "created"
})
public record MatchSummary(
    String id,
    String gameType,
    MatchState state,
    int players,
    int maxPlayers,
    @JsonProperty("public") boolean publicMatch,
    boolean joinable,
    long created)
    implements MatchView {}
