/*
 * どこで: Session ビューモデル
 * 何を: 単一 Match の詳細表示を定義する
 * なぜ: ロスター・設定・ゲーム状態をクライアントへまとめて渡すため
 */
package com.quasar.session.model.view;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.quasar.session.model.MatchConfig;
import com.quasar.session.model.MatchState;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({
  "id",
  "gameType",
  "state",
  "players",
  "maxPlayers",
  "public",
  "joinable",
  "created",
  "config",
  "hostSlot",
  "started",
  "lastActivity",
  "playerList",
  "game"
})
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "ビュー record は応答整形専用のため")
public record MatchDetail(
    String id,
    String gameType,
    MatchState state,
    int players,
    int maxPlayers,
    @JsonProperty("public") boolean publicMatch,
    boolean joinable,
    long created,
    MatchConfig config,
    Integer hostSlot,
    Long started,
    long lastActivity,
    List<PlayerView> playerList,
    Map<String, Object> game)
    implements MatchView {}
