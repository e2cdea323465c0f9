/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: セッション期限の判定をテストから固定時刻で検証できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
