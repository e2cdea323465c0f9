/*
 * どこで: identity API 層テスト
 * 何を: 例外ハンドラのエラーコード対応と権限拒否メトリクスを検証する
 * なぜ: 失敗理由ごとの HTTP ステータスと計測が回帰しないことを保証するため
 */
package com.example.identity.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.identity.auth.Action;
import com.example.identity.auth.Operation;
import com.example.identity.auth.PermissionDeniedException;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.idp.LoginFailureException.Reason;
import com.example.identity.service.AccountIntegrationException;
import com.example.identity.service.IdentityMetrics;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class IdentityApiExceptionHandlerTest {

  @Test
  void handleLoginFailureMapsReasonToStatus() {
    final IdentityApiExceptionHandler handler =
        new IdentityApiExceptionHandler(Mockito.mock(IdentityMetrics.class));

    assertThat(status(handler, Reason.BAD_REQUEST)).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(status(handler, Reason.TRANSPORT)).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(status(handler, Reason.INVALID_RESPONSE)).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(status(handler, Reason.REJECTED)).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(status(handler, Reason.MALFORMED_CREDENTIAL)).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(status(handler, Reason.USER_NOT_FOUND)).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(status(handler, Reason.INTERNAL)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
  }

  @Test
  void handleInternalFailureHidesCause() {
    final IdentityApiExceptionHandler handler =
        new IdentityApiExceptionHandler(Mockito.mock(IdentityMetrics.class));

    final ResponseEntity<ApiErrorResponse> response =
        handler.handleLoginFailure(
            new LoginFailureException(Reason.INTERNAL, "login verification failed"));

    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("LOGIN_INTERNAL_ERROR", "login failed"));
  }

  @Test
  void handleLookupOutageDoesNotEchoExternalId() {
    final IdentityApiExceptionHandler handler =
        new IdentityApiExceptionHandler(Mockito.mock(IdentityMetrics.class));
    final LoginFailureException failure =
        new LoginFailureException(
            Reason.TRANSPORT,
            "cannot get user details for \"https://login.ubuntu.com/+id/u123\"",
            new AccountIntegrationException(
                AccountIntegrationException.Reason.TIMEOUT, "account request timeout"));

    final ResponseEntity<ApiErrorResponse> response = handler.handleLoginFailure(failure);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("LOGIN_UPSTREAM_ERROR", "user lookup failed"));
  }

  @Test
  void handleValidatorOutageKeepsMessage() {
    final IdentityApiExceptionHandler handler =
        new IdentityApiExceptionHandler(Mockito.mock(IdentityMetrics.class));

    final ResponseEntity<ApiErrorResponse> response =
        handler.handleLoginFailure(
            new LoginFailureException(Reason.TRANSPORT, "cannot reach OAuth validation service"));

    assertThat(response.getBody().message()).isEqualTo("cannot reach OAuth validation service");
  }

  @Test
  void handlePermissionDeniedRecordsActionMetric() {
    final IdentityMetrics metrics = Mockito.mock(IdentityMetrics.class);
    final IdentityApiExceptionHandler handler = new IdentityApiExceptionHandler(metrics);

    final ResponseEntity<ApiErrorResponse> response =
        handler.handlePermissionDenied(
            new PermissionDeniedException(Operation.user("bob", Action.WRITE_ADMIN)));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().code()).isEqualTo("PERMISSION_DENIED");
    verify(metrics).recordPermissionDenied("writeAdmin");
  }

  @Test
  void handlePermissionDeniedForNoneRecordsNoneMetric() {
    final IdentityMetrics metrics = Mockito.mock(IdentityMetrics.class);
    final IdentityApiExceptionHandler handler = new IdentityApiExceptionHandler(metrics);

    handler.handlePermissionDenied(new PermissionDeniedException(Operation.NONE));

    verify(metrics).recordPermissionDenied("none");
  }

  @Test
  void handlePermissionDeniedForLoginIsUnauthenticated() {
    final IdentityMetrics metrics = Mockito.mock(IdentityMetrics.class);
    final IdentityApiExceptionHandler handler = new IdentityApiExceptionHandler(metrics);

    final ResponseEntity<ApiErrorResponse> response =
        handler.handlePermissionDenied(new PermissionDeniedException(Operation.LOGIN));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(response.getBody().code()).isEqualTo("UNAUTHENTICATED");
    verifyNoInteractions(metrics);
  }

  private static HttpStatus status(IdentityApiExceptionHandler handler, Reason reason) {
    return HttpStatus.valueOf(
        handler
            .handleLoginFailure(new LoginFailureException(reason, "x"))
            .getStatusCode()
            .value());
  }
}
