package com.example.identity.api;

import com.example.identity.api.request.WhoAmIRequest;
import com.example.identity.api.response.WhoAmIResponse;
import com.example.identity.auth.Credentials;
import com.example.identity.auth.RequestAuthorizer;
import com.example.identity.config.SessionConfig;
import com.example.identity.model.LocalUser;
import com.example.identity.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class WhoAmIController {

  private final RequestAuthorizer requestAuthorizer;
  private final SessionService sessionService;
  private final SessionConfig sessionConfig;

  @GetMapping("/v1/whoami")
  public WhoAmIResponse whoAmI(HttpServletRequest request) {
    final LocalUser user = sessionService.findUser(sessionConfig.sessionId(request)).orElse(null);
    final Credentials credentials =
        user == null ? Credentials.anonymous() : Credentials.authenticated(user);
    requestAuthorizer.authorize(new WhoAmIRequest(), credentials);
    return new WhoAmIResponse(user.userId(), user.username(), user.roles());
  }
}
