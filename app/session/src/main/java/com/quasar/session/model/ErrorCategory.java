/*
 * どこで: Session ドメインモデル
 * 何を: 失敗種別の大分類を定義する
 * なぜ: API 層で HTTP ステータスへ機械的に対応付けるため
 */
package com.quasar.session.model;

public enum ErrorCategory {
  CAPACITY,
  LOOKUP,
  CONFLICT,
  STATE,
  VALIDATION
}
