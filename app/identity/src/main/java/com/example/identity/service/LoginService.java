/*
 * どこで: identity サービス層
 * 何を: IdP を選んでログイン開始 URL を返し、コールバックの検証結果を 1 回だけ通知する
 * なぜ: IdP ごとの差分をプラグインに閉じ込め、成功/失敗の通知規約をここで保証するため
 */
package com.example.identity.service;

import com.example.identity.config.IdentityProperties;
import com.example.identity.idp.IdentityProvider;
import com.example.identity.idp.IdentityProviderRegistry;
import com.example.identity.idp.LoginAttemptState;
import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.idp.LoginFailureException.Reason;
import com.example.identity.idp.LoginOutcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LoginService {

  private static final Logger logger = LoggerFactory.getLogger(LoginService.class);

  private final IdentityProviderRegistry registry;
  private final LoginCompletion loginCompletion;
  private final IdentityProperties properties;

  /**
   * Starts a login attempt with the named provider.
   *
   * @throws com.example.identity.idp.UnknownIdentityProviderException if no such provider
   */
  public String loginUrl(String idp, String waitId) {
    final IdentityProvider provider = registry.get(idp);
    transition(idp, waitId, LoginAttemptState.STARTED);
    final String url = provider.loginUrl(properties.idpCallbackBase(provider.name()), waitId);
    transition(idp, waitId, LoginAttemptState.AWAITING_CALLBACK);
    return url;
  }

  /**
   * Verifies a provider callback and reports the outcome to {@link LoginCompletion} exactly once.
   *
   * @throws com.example.identity.idp.UnknownIdentityProviderException if no such provider
   */
  public LoginOutcome handleCallback(String idp, LoginContext context) {
    final IdentityProvider provider = registry.get(idp);
    transition(idp, context.waitId(), LoginAttemptState.VERIFYING);

    LoginOutcome outcome;
    try {
      outcome = provider.handleLogin(context);
    } catch (RuntimeException ex) {
      outcome =
          LoginOutcome.failure(
              new LoginFailureException(Reason.INTERNAL, "login verification failed", ex));
    }
    if (outcome == null) {
      outcome =
          LoginOutcome.failure(
              new LoginFailureException(Reason.INTERNAL, "identity provider returned no outcome"));
    }
    if (outcome instanceof LoginOutcome.Success success && !success.user().isActive()) {
      outcome =
          LoginOutcome.failure(new LoginFailureException(Reason.REJECTED, "account is not active"));
    }

    if (outcome instanceof LoginOutcome.Success success) {
      transition(idp, context.waitId(), LoginAttemptState.SUCCEEDED);
      loginCompletion.onLoginSuccess(idp, context, success.user());
    } else if (outcome instanceof LoginOutcome.Failure failure) {
      transition(idp, context.waitId(), LoginAttemptState.FAILED);
      loginCompletion.onLoginFailure(idp, context, failure.cause());
    }
    return outcome;
  }

  private void transition(String idp, String waitId, LoginAttemptState state) {
    logger.debug("login attempt idp={} wait_id={} state={}", idp, waitId, state);
  }
}
