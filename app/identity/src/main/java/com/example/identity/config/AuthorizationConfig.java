/*
 * どこで: identity 設定
 * 何を: 認可エンジン未設定時の CapabilityChecker を提供する
 * なぜ: エンジンが配線されていない構成でも全拒否で安全側に倒すため
 */
package com.example.identity.config;

import com.example.identity.auth.CapabilityChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AuthorizationConfig {

  private static final Logger logger = LoggerFactory.getLogger(AuthorizationConfig.class);

  @Bean
  @ConditionalOnMissingBean(CapabilityChecker.class)
  CapabilityChecker denyAllCapabilityChecker() {
    logger.warn("no capability checker configured; every capability check is denied");
    return (operation, credentials) -> false;
  }
}
