/*
 * どこで: Session イベント
 * 何を: Registry / Matchmaker が発行するイベント種別を定義する
 * なぜ: 購読キーと NATS subject の末尾を 1 か所で固定するため
 */
package com.quasar.session.event;

public enum SessionEventType {
  CREATED("created"),
  JOINED("joined"),
  LEFT("left"),
  ENDED("ended"),
  QUEUED("queued"),
  DEQUEUED("dequeued"),
  TIMEOUT("timeout"),
  MATCHED("matched"),
  PRIVATE_CREATED("privateCreated");

  private final String value;

  SessionEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
