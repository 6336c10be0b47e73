/*
 * どこで: Session API
 * 何を: Registry / Matchmaker が返した失敗 Result を例外として運ぶ
 * なぜ: ErrorKind の分類から HTTP ステータスを一元的に決めるため
 */
package com.quasar.session.api;

import com.quasar.common.result.Result;
import com.quasar.session.model.ErrorKind;

public class SessionRequestException extends RuntimeException {

  private final ErrorKind kind;

  public SessionRequestException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public static <T> SessionRequestException from(Result.Err<T, ErrorKind> err) {
    return new SessionRequestException(err.kind(), err.message());
  }

  public ErrorKind kind() {
    return kind;
  }

  public String code() {
    return "SESSION_" + kind.name();
  }
}
