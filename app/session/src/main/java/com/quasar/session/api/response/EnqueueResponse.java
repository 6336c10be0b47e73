/*
 * どこで: Session API レスポンス DTO
 * 何を: キュー参加 API の成功応答を定義する
 * なぜ: 即時成立した場合の Match 情報を同じ応答で返すため
 */
package com.quasar.session.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.quasar.session.model.view.MatchView;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueResponse(String gameType, int position, boolean matched, MatchView match) {}
