/*
 * どこで: Common 共通型
 * 何を: 成功値か、種別付きの失敗のどちらかを表す
 * なぜ: 想定内の失敗を例外ではなく戻り値で伝播させるため
 */
package com.quasar.common.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a success value or a typed failure.
 *
 * @param <T> success value type
 * @param <E> failure kind, usually an enum
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

  static <T, E> Result<T, E> ok(T value) {
    return new Ok<>(value);
  }

  static <T, E> Result<T, E> err(E kind, String message) {
    return new Err<>(kind, message);
  }

  boolean isOk();

  default boolean isErr() {
    return !isOk();
  }

  /**
   * 役割: 成功値を取り出す。
   * 動作: 失敗時は IllegalStateException を送出する。
   * 前提: 呼び出し側で isOk() を確認済みであること。
   */
  T value();

  /** 役割: 失敗種別を返す。 動作: 成功時は IllegalStateException を送出する。 */
  E kind();

  /** 役割: 失敗メッセージを返す。 動作: 成功時は IllegalStateException を送出する。 */
  String message();

  <U> Result<U, E> map(Function<? super T, ? extends U> mapper);

  <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper);

  /**
   * 役割: 失敗を例外へ変換して成功値を返す。
   * 動作: 成功なら値を返し、失敗なら factory が作った例外を送出する。
   * 前提: API 境界など、例外へ切り替える層でのみ使う。
   */
  <X extends RuntimeException> T orElseThrow(Function<Err<T, E>, X> exceptionFactory);

  record Ok<T, E>(T value) implements Result<T, E> {

    @Override
    public boolean isOk() {
      return true;
    }

    @Override
    public E kind() {
      throw new IllegalStateException("ok result has no error kind");
    }

    @Override
    public String message() {
      throw new IllegalStateException("ok result has no error message");
    }

    @Override
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
      return new Ok<>(mapper.apply(value));
    }

    @Override
    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
      return mapper.apply(value);
    }

    @Override
    public <X extends RuntimeException> T orElseThrow(Function<Err<T, E>, X> exceptionFactory) {
      return value;
    }
  }

  record Err<T, E>(E kind, String message) implements Result<T, E> {

    public Err {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public boolean isOk() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("error result has no value: " + message);
    }

    @Override
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
      return new Err<>(kind, message);
    }

    @Override
    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
      return new Err<>(kind, message);
    }

    @Override
    public <X extends RuntimeException> T orElseThrow(Function<Err<T, E>, X> exceptionFactory) {
      throw exceptionFactory.apply(this);
    }
  }
}
