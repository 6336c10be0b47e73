/*
 * どこで: Session ドメインモデル
 * 何を: Match のライフサイクル状態を定義する
 * なぜ: 遷移ガードと API 応答の状態表記を一致させるため
 */
package com.quasar.session.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchState {
  LOBBY("lobby"),
  PLAYING("playing"),
  PAUSED("paused"),
  ENDED("ended");

  private final String value;

  MatchState(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * 役割: クエリ文字列の state を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: state は null でないこと。
   */
  public static MatchState fromValue(String state) {
    for (MatchState matchState : values()) {
      if (matchState.value.equalsIgnoreCase(state)) {
        return matchState;
      }
    }
    throw new IllegalArgumentException("unsupported state: " + state);
  }
}
