package com.example.identity.service;

import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.model.LocalUser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MetricsLoginCompletion implements LoginCompletion {

  private static final Logger logger = LoggerFactory.getLogger(MetricsLoginCompletion.class);

  private final IdentityMetrics identityMetrics;

  @Override
  public void onLoginSuccess(String idp, LoginContext context, LocalUser user) {
    identityMetrics.recordLoginResult(idp, "success");
    logger.info("login succeeded idp={} user_id={}", idp, user.userId());
  }

  @Override
  public void onLoginFailure(String idp, LoginContext context, LoginFailureException cause) {
    identityMetrics.recordLoginResult(idp, "failure");
    identityMetrics.recordLoginFailure(idp, cause.reason().name());
    logger.warn(
        "login failed idp={} reason={}: {}", idp, cause.reason(), cause.getMessage(), cause);
  }
}
