/*
 * どこで: Session アプリのインフラ設定
 * 何を: イベント publish 専用の単一スレッド executor を提供する
 * なぜ: NATS の応答待ちを Registry / Matchmaker のロック外へ出すため
 */
package com.quasar.session.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SessionEventExecutorConfig {

  static final int QUEUE_CAPACITY = 10_000;

  /** 単一スレッドなので publish 順はイベント発生順と一致する。 */
  @Bean
  public ThreadPoolTaskExecutor sessionEventExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(QUEUE_CAPACITY);
    executor.setThreadNamePrefix("session-event-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
