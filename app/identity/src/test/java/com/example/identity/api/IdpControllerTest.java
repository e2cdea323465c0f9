package com.example.identity.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.identity.api.response.IdpDescriptor;
import com.example.identity.config.SessionConfig;
import com.example.identity.idp.IdentityProviderRegistry;
import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.idp.LoginFailureException.Reason;
import com.example.identity.idp.LoginOutcome;
import com.example.identity.idp.UnknownIdentityProviderException;
import com.example.identity.model.LocalUser;
import com.example.identity.service.AccountIntegrationException;
import com.example.identity.service.IdentityMetrics;
import com.example.identity.service.LoginService;
import com.example.identity.service.SessionService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IdpController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({IdentityApiExceptionHandler.class, SessionConfig.class})
class IdpControllerTest {

  private static final LocalUser USER = new LocalUser("user-1", "bob", "ACTIVE", List.of("USER"));

  @Autowired private MockMvc mockMvc;

  @MockitoBean private IdentityProviderRegistry registry;
  @MockitoBean private LoginService loginService;
  @MockitoBean private SessionService sessionService;
  @MockitoBean private IdentityMetrics identityMetrics;

  @Test
  void listReturnsEnabledProviders() throws Exception {
    when(registry.descriptors())
        .thenReturn(List.of(new IdpDescriptor("usso_oauth", "Ubuntu SSO OAuth", false)));

    mockMvc
        .perform(get("/v1/idp"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("usso_oauth"))
        .andExpect(jsonPath("$[0].description").value("Ubuntu SSO OAuth"))
        .andExpect(jsonPath("$[0].interactive").value(false));
  }

  @Test
  void loginReturnsProviderLoginUrl() throws Exception {
    when(loginService.loginUrl("usso_oauth", "w-1"))
        .thenReturn("http://localhost:8080/v1/idp/usso_oauth/oauth?waitid=w-1");

    mockMvc
        .perform(get("/v1/idp/usso_oauth/login").param("waitid", "w-1"))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath("$.loginUrl")
                .value("http://localhost:8080/v1/idp/usso_oauth/oauth?waitid=w-1"));
  }

  @Test
  void loginReturns404ForUnknownProvider() throws Exception {
    when(loginService.loginUrl("nope", null))
        .thenThrow(new UnknownIdentityProviderException("nope"));

    mockMvc
        .perform(get("/v1/idp/nope/login"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("IDP_NOT_FOUND"));
  }

  @Test
  void callbackSuccessIssuesSessionCookie() throws Exception {
    when(loginService.handleCallback(eq("usso_oauth"), any()))
        .thenReturn(LoginOutcome.success(USER));
    when(sessionService.createSession(USER)).thenReturn("sess-1");

    mockMvc
        .perform(
            get("/v1/idp/usso_oauth/oauth")
                .queryParam("waitid", "w-1")
                .header(HttpHeaders.AUTHORIZATION, "OAuth oauth_consumer_key=\"u123\""))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.userId").value("user-1"))
        .andExpect(jsonPath("$.username").value("bob"))
        .andExpect(
            header().string(HttpHeaders.SET_COOKIE, containsString("IDENTITY_SESSION=sess-1")))
        .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")));

    final ArgumentCaptor<LoginContext> captor = ArgumentCaptor.forClass(LoginContext.class);
    verify(loginService).handleCallback(eq("usso_oauth"), captor.capture());
    final LoginContext context = captor.getValue();
    assertThat(context.requestUrl())
        .isEqualTo("http://localhost:8080/v1/idp/usso_oauth/oauth?waitid=w-1");
    assertThat(context.method()).isEqualTo("GET");
    assertThat(context.waitId()).isEqualTo("w-1");
    assertThat(context.authorization()).isEqualTo("OAuth oauth_consumer_key=\"u123\"");
    assertThat(context.params().getFirst("waitid")).isEqualTo("w-1");
  }

  @Test
  void callbackAcceptsPost() throws Exception {
    when(loginService.handleCallback(eq("usso_oauth"), any()))
        .thenReturn(LoginOutcome.success(USER));
    when(sessionService.createSession(USER)).thenReturn("sess-2");

    mockMvc.perform(post("/v1/idp/usso_oauth/oauth")).andExpect(status().isOk());
  }

  @Test
  void callbackRejectedReturns401() throws Exception {
    when(loginService.handleCallback(eq("usso_oauth"), any()))
        .thenReturn(
            LoginOutcome.failure(
                new LoginFailureException(Reason.REJECTED, "invalid OAuth credentials")));

    mockMvc
        .perform(get("/v1/idp/usso_oauth/oauth"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("LOGIN_FAILED"))
        .andExpect(jsonPath("$.message").value("invalid OAuth credentials"));
    verify(sessionService, never()).createSession(any());
  }

  @Test
  void callbackUnknownUserHidesLookupDetails() throws Exception {
    when(loginService.handleCallback(eq("usso_oauth"), any()))
        .thenReturn(
            LoginOutcome.failure(
                new LoginFailureException(
                    Reason.USER_NOT_FOUND, "cannot get user details for \"x\"")));

    mockMvc
        .perform(get("/v1/idp/usso_oauth/oauth"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("AUTHENTICATION_FAILED"))
        .andExpect(jsonPath("$.message").value("authentication failed"));
  }

  @Test
  void callbackValidatorOutageReturns502() throws Exception {
    when(loginService.handleCallback(eq("usso_oauth"), any()))
        .thenReturn(
            LoginOutcome.failure(
                new LoginFailureException(
                    Reason.TRANSPORT, "cannot reach OAuth validation service")));

    mockMvc
        .perform(get("/v1/idp/usso_oauth/oauth"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("LOGIN_UPSTREAM_ERROR"));
  }

  @Test
  void callbackAccountOutageHidesExternalId() throws Exception {
    when(loginService.handleCallback(eq("usso_oauth"), any()))
        .thenReturn(
            LoginOutcome.failure(
                new LoginFailureException(
                    Reason.TRANSPORT,
                    "cannot get user details for \"https://login.ubuntu.com/+id/u123\"",
                    new AccountIntegrationException(
                        AccountIntegrationException.Reason.BAD_GATEWAY, "account server error"))));

    mockMvc
        .perform(get("/v1/idp/usso_oauth/oauth"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.message").value("user lookup failed"));
  }

  @Test
  void callbackReturns404ForUnknownProvider() throws Exception {
    when(loginService.handleCallback(eq("nope"), any()))
        .thenThrow(new UnknownIdentityProviderException("nope"));

    mockMvc
        .perform(get("/v1/idp/nope/oauth"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("identity provider \"nope\" not found"));
  }
}
