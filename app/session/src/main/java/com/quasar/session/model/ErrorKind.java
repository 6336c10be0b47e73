/*
 * どこで: Session ドメインモデル
 * 何を: Registry / Matchmaker が返す想定内の失敗を列挙する
 * なぜ: 自由文字列の比較ではなく型で失敗を判別するため
 */
package com.quasar.session.model;

import com.quasar.common.result.Result;

public enum ErrorKind {
  NO_MATCH_SLOTS("No match slots available", ErrorCategory.CAPACITY),
  MATCH_FULL("Match is full", ErrorCategory.CAPACITY),
  NO_PLAYER_SLOTS("No slots available", ErrorCategory.CAPACITY),
  MATCH_NOT_FOUND("Match not found", ErrorCategory.LOOKUP),
  PLAYER_NOT_FOUND("Player not found", ErrorCategory.LOOKUP),
  INVALID_INVITE_CODE("Invalid invite code", ErrorCategory.LOOKUP),
  PLAYER_ALREADY_IN_MATCH("Player already in a match", ErrorCategory.CONFLICT),
  PLAYER_ALREADY_QUEUED("Player already in queue", ErrorCategory.CONFLICT),
  PLAYER_NOT_QUEUED("Player not in queue", ErrorCategory.CONFLICT),
  PLAYER_NOT_IN_MATCH("Player not in a match", ErrorCategory.CONFLICT),
  PLAYER_NOT_FOUND_IN_QUEUE("Player not found in queue", ErrorCategory.CONFLICT),
  CANNOT_START("Cannot start match", ErrorCategory.STATE),
  MATCH_NOT_PLAYING("Match not playing", ErrorCategory.STATE),
  MATCH_NOT_PAUSED("Match not paused", ErrorCategory.STATE),
  UNKNOWN_GAME_TYPE("Unknown game type", ErrorCategory.VALIDATION),
  MATCH_NOT_JOINABLE("Match not joinable", ErrorCategory.VALIDATION);

  private final String message;
  private final ErrorCategory category;

  ErrorKind(String message, ErrorCategory category) {
    this.message = message;
    this.category = category;
  }

  public String message() {
    return message;
  }

  public ErrorCategory category() {
    return category;
  }

  /** 役割: 既定メッセージで失敗 Result を作る。 */
  public <T> Result<T, ErrorKind> result() {
    return Result.err(this, message);
  }

  /** 役割: 詳細付きメッセージ（例: "Unknown game type: chess"）で失敗 Result を作る。 */
  public <T> Result<T, ErrorKind> result(String detail) {
    return Result.err(this, message + ": " + detail);
  }
}
