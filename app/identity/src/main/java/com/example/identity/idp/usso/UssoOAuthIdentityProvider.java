package com.example.identity.idp.usso;

import com.example.identity.config.UssoOAuthProperties;
import com.example.identity.idp.IdentityProvider;
import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.idp.LoginFailureException.Reason;
import com.example.identity.idp.LoginOutcome;
import com.example.identity.model.LocalUser;
import com.example.identity.service.AccountIntegrationException;
import com.example.identity.service.UserNotFoundException;
import com.example.identity.service.UserResolver;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Non-interactive provider: the client signs its callback request with an Ubuntu SSO OAuth token
 * and the signature is checked by the SSO validation service.
 */
@Component
@RequiredArgsConstructor
public class UssoOAuthIdentityProvider implements IdentityProvider {

  public static final String NAME = "usso_oauth";

  private final OAuthSignatureVerifier signatureVerifier;
  private final UserResolver userResolver;
  private final UssoOAuthProperties properties;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Ubuntu SSO OAuth";
  }

  @Override
  public boolean interactive() {
    return false;
  }

  @Override
  public String loginUrl(String callbackBase, String waitId) {
    final String callback = callbackBase + properties.callbackPath();
    if (waitId == null || waitId.isEmpty()) {
      return callback;
    }
    return callback + "?waitid=" + URLEncoder.encode(waitId, StandardCharsets.UTF_8);
  }

  @Override
  public LoginOutcome handleLogin(LoginContext context) {
    final String externalId;
    try {
      externalId = signatureVerifier.verify(context);
    } catch (LoginFailureException ex) {
      return LoginOutcome.failure(ex);
    }

    final LocalUser user;
    try {
      user = userResolver.findUserByExternalId(externalId);
    } catch (UserNotFoundException ex) {
      return LoginOutcome.failure(
          new LoginFailureException(Reason.USER_NOT_FOUND, userDetailsMessage(externalId), ex));
    } catch (AccountIntegrationException ex) {
      return LoginOutcome.failure(
          new LoginFailureException(Reason.TRANSPORT, userDetailsMessage(externalId), ex));
    }
    return LoginOutcome.success(user);
  }

  private String userDetailsMessage(String externalId) {
    return "cannot get user details for \"" + externalId + "\"";
  }
}
