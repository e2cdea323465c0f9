/*
 * どこで: identity 設定
 * 何を: 公開 URL / 有効化する IdP / セッション Cookie 名を保持する
 * なぜ: 環境ごとに callback URL と IdP 構成を外部化するため
 */
package com.example.identity.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "identity")
public record IdentityProperties(
    String location, List<String> enabledIdps, String sessionCookieName, Duration sessionTtl) {

  public IdentityProperties {
    location = location == null || location.isBlank() ? "http://localhost:8080" : location;
    // 末尾の / は callback URL の組み立て時に二重になるため落とす
    while (location.endsWith("/")) {
      location = location.substring(0, location.length() - 1);
    }
    enabledIdps = enabledIdps == null ? List.of() : List.copyOf(enabledIdps);
    sessionCookieName =
        sessionCookieName == null || sessionCookieName.isBlank()
            ? "IDENTITY_SESSION"
            : sessionCookieName;
    sessionTtl = sessionTtl == null ? Duration.ofHours(1) : sessionTtl;
  }

  public String idpCallbackBase(String idpName) {
    return location + "/v1/idp/" + idpName;
  }
}
