/*
 * どこで: identity 設定
 * 何を: OAuth 署名検証 (Ubuntu SSO) の接続先とタイムアウトを保持する
 * なぜ: 検証エンドポイントを環境ごとに差し替え可能にするため
 */
package com.example.identity.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "identity.usso")
public record UssoOAuthProperties(
    String baseUrl,
    String validatePath,
    String callbackPath,
    Duration connectTimeout,
    Duration readTimeout) {

  @ConstructorBinding
  public UssoOAuthProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://login.ubuntu.com" : baseUrl;
    validatePath =
        validatePath == null || validatePath.isBlank()
            ? "/api/v2/requests/validate"
            : validatePath;
    callbackPath = callbackPath == null || callbackPath.isBlank() ? "/oauth" : callbackPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  public UssoOAuthProperties(String baseUrl) {
    this(baseUrl, null, null, null, null);
  }
}
