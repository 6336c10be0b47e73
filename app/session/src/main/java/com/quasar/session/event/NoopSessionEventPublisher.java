/*
 * どこで: Session イベント
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカル実行やテストで NATS なしでもアプリを起動可能にするため
 */
package com.quasar.session.event;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopSessionEventPublisher implements SessionEventPublisher {

  /**
   * 役割: NATS 無効時に publish 呼び出しを吸収する。
   * 動作: 何もしない。
   * 前提: なし。
   */
  @Override
  public void publish(SessionEventMessage message) {
    // no-op
  }
}
