/*
 * どこで: Session 設定
 * 何を: セッションイベント publish 先の subject 設定を保持する
 * なぜ: 配信レイヤーが購読する subject を運用で切り替えられるようにするため
 */
package com.quasar.session.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "session.nats")
public record SessionNatsProperties(String subjectPrefix) {

  public String subjectFor(String eventType) {
    final String prefix =
        subjectPrefix == null || subjectPrefix.isBlank() ? "session.events" : subjectPrefix;
    return prefix + "." + eventType;
  }
}
