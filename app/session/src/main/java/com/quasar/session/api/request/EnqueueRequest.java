/*
 * どこで: Session API リクエスト DTO
 * 何を: キュー参加 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.quasar.session.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record EnqueueRequest(
    @Size(max = 3) String monogram,
    @Size(max = 32) String name,
    @PositiveOrZero Double skill,
    Map<String, Object> preferences) {}
