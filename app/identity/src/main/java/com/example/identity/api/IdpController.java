/*
 * どこで: identity API
 * 何を: IdP 一覧・ログイン開始 URL・IdP コールバックのエンドポイント
 * なぜ: HTTP 入力を LoginContext に詰め替え、IdP の検証を LoginService に委ねるため
 */
package com.example.identity.api;

import com.example.identity.api.response.IdpDescriptor;
import com.example.identity.api.response.LoginResponse;
import com.example.identity.api.response.LoginUrlResponse;
import com.example.identity.config.IdentityProperties;
import com.example.identity.config.SessionConfig;
import com.example.identity.idp.IdentityProviderRegistry;
import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginOutcome;
import com.example.identity.model.LocalUser;
import com.example.identity.service.LoginService;
import com.example.identity.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/idp")
@RequiredArgsConstructor
public class IdpController {

  static final String WAIT_ID_PARAM = "waitid";

  private final IdentityProviderRegistry registry;
  private final LoginService loginService;
  private final SessionService sessionService;
  private final SessionConfig sessionConfig;
  private final IdentityProperties properties;

  @GetMapping
  public List<IdpDescriptor> list() {
    return registry.descriptors();
  }

  @GetMapping("/{idp}/login")
  public LoginUrlResponse login(
      @PathVariable("idp") String idp,
      @RequestParam(name = WAIT_ID_PARAM, required = false) String waitId) {
    return new LoginUrlResponse(loginService.loginUrl(idp, waitId));
  }

  /**
   * IdP からのコールバック。検証に失敗した場合は LoginFailureException を投げ、
   * IdentityApiExceptionHandler が応答を組み立てる。
   */
  @RequestMapping(
      path = "/{idp}/oauth",
      method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<LoginResponse> callback(
      @PathVariable("idp") String idp, HttpServletRequest request) {
    final LoginOutcome outcome = loginService.handleCallback(idp, toLoginContext(request));
    if (outcome instanceof LoginOutcome.Failure failure) {
      throw failure.cause();
    }
    final LocalUser user = ((LoginOutcome.Success) outcome).user();
    final String sessionId = sessionService.createSession(user);
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, sessionConfig.sessionCookie(sessionId).toString())
        .body(new LoginResponse(user.userId(), user.username()));
  }

  private LoginContext toLoginContext(HttpServletRequest request) {
    final HttpHeaders headers = new HttpHeaders();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.addAll(name, Collections.list(request.getHeaders(name)));
    }
    final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    for (Map.Entry<String, String[]> entry : request.getParameterMap().entrySet()) {
      params.addAll(entry.getKey(), List.of(entry.getValue()));
    }
    return new LoginContext(
        requestUrl(request),
        request.getMethod(),
        headers,
        params,
        request.getParameter(WAIT_ID_PARAM));
  }

  // 署名は公開 URL に対して計算されるため、プロキシ背後でも identity.location を基準にする
  private String requestUrl(HttpServletRequest request) {
    final String query = request.getQueryString();
    final String path = properties.location() + request.getRequestURI();
    return query == null ? path : path + "?" + query;
  }
}
