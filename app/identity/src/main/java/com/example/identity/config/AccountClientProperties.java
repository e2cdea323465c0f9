package com.example.identity.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "account")
public record AccountClientProperties(
    String baseUrl,
    String internalApiToken,
    String internalApiHeaderName,
    String resolveExternalIdPath,
    Duration connectTimeout,
    Duration readTimeout) {

  @ConstructorBinding
  public AccountClientProperties {
    baseUrl = baseUrl == null ? "http://account:80" : baseUrl;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    resolveExternalIdPath =
        resolveExternalIdPath == null || resolveExternalIdPath.isBlank()
            ? "/identities:lookup"
            : resolveExternalIdPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  public AccountClientProperties(
      String baseUrl,
      String internalApiToken,
      String internalApiHeaderName,
      String resolveExternalIdPath) {
    this(baseUrl, internalApiToken, internalApiHeaderName, resolveExternalIdPath, null, null);
  }
}
