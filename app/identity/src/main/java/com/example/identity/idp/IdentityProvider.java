/*
 * どこで: identity の IdP プラグイン境界
 * 何を: すべての IdP が実装する能力の集合
 * なぜ: ログイン開始/コールバック処理を IdP 名だけで切り替えられるようにするため
 */
package com.example.identity.idp;

/**
 * An identity provider that can prove who a user is and hand back a local user.
 *
 * <p>Implementations are Spring beans; {@link IdentityProviderRegistry} collects them at startup.
 */
public interface IdentityProvider {

  /** Stable machine identifier, unique across configured providers. */
  String name();

  /** Human readable label for provider listings. */
  String description();

  /**
   * Whether login needs a browser redirect ({@code true}) or completes with a single signed
   * callback ({@code false}).
   */
  boolean interactive();

  /**
   * Builds the URL the caller is sent to, or calls back to, to start authentication.
   *
   * @param callbackBase base URL of this provider's endpoints on the identity service
   * @param waitId correlation token of the login attempt; may be {@code null} or empty
   */
  String loginUrl(String callbackBase, String waitId);

  /**
   * Verifies the callback and resolves the local user.
   *
   * <p>Returns exactly one outcome. Expected failures are reported as {@link
   * LoginOutcome.Failure}, never thrown.
   */
  LoginOutcome handleLogin(LoginContext context);
}
