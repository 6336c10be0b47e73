/*
 * どこで: Session API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: ヘッダ欠落やクエリ値の不正を 400 へ正規化するため
 */
package com.quasar.session.api;

public class InvalidSessionRequestException extends RuntimeException {
  public InvalidSessionRequestException(String message) {
    super(message);
  }
}
