/*
 * どこで: identity 設定
 * 何を: セッション Cookie の属性を組み立てる
 * なぜ: TTL/Cookie 属性を環境ごとに切替可能にするため
 */
package com.example.identity.config;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class SessionConfig {

  private final IdentityProperties properties;

  public SessionConfig(IdentityProperties properties) {
    this.properties = properties;
  }

  /** Session id from the request's session cookie, or {@code null}. */
  public String sessionId(HttpServletRequest request) {
    final Cookie cookie = WebUtils.getCookie(request, properties.sessionCookieName());
    return cookie == null ? null : cookie.getValue();
  }

  /** HttpOnly, SameSite=Lax; Secure only when the service is served over https. */
  public ResponseCookie sessionCookie(String sessionId) {
    return ResponseCookie.from(properties.sessionCookieName(), sessionId)
        .httpOnly(true)
        .secure(properties.location().startsWith("https://"))
        .sameSite("Lax")
        .path("/")
        .maxAge(properties.sessionTtl())
        .build();
  }
}
