/*
 * どこで: Common 共通設定
 * 何を: Clock と乱数生成器を DI 可能にする
 * なぜ: 時刻依存の判定と招待コード生成をテストで差し替えられるようにするため
 */
package com.quasar.common.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.random.RandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RandomGenerator secureRandom() {
    return new SecureRandom();
  }
}
