/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 送信時刻や失効判定の時刻をテストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // テスト側で固定 Clock を定義した場合はそちらを優先する
  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
