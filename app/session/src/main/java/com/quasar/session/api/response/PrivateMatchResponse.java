/*
 * どこで: Session API レスポンス DTO
 * 何を: 非公開 Match 作成 API の成功応答を定義する
 * なぜ: 作成者が共有する招待コードを返却するため
 */
package com.quasar.session.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.quasar.session.model.view.MatchView;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrivateMatchResponse(String matchId, String inviteCode, int slot, MatchView match) {}
