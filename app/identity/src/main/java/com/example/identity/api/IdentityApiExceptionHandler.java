package com.example.identity.api;

import com.example.identity.auth.Operation;
import com.example.identity.auth.PermissionDeniedException;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.idp.UnknownIdentityProviderException;
import com.example.identity.service.AccountIntegrationException;
import com.example.identity.service.IdentityMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class IdentityApiExceptionHandler {

  private final IdentityMetrics identityMetrics;

  @ExceptionHandler(UnknownIdentityProviderException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownIdp(UnknownIdentityProviderException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("IDP_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(LoginFailureException.class)
  public ResponseEntity<ApiErrorResponse> handleLoginFailure(LoginFailureException ex) {
    final String code =
        switch (ex.reason()) {
          case BAD_REQUEST -> "LOGIN_BAD_REQUEST";
          case TRANSPORT, INVALID_RESPONSE -> "LOGIN_UPSTREAM_ERROR";
          case REJECTED, MALFORMED_CREDENTIAL -> "LOGIN_FAILED";
          case USER_NOT_FOUND -> "AUTHENTICATION_FAILED";
          case INTERNAL -> "LOGIN_INTERNAL_ERROR";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
          case TRANSPORT, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
          case REJECTED, MALFORMED_CREDENTIAL, USER_NOT_FOUND -> HttpStatus.UNAUTHORIZED;
          case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    // lookup の詳細 (外部 ID を含む) は LoginCompletion 側でログ済み。応答には載せない
    final String message;
    if (ex.reason() == LoginFailureException.Reason.USER_NOT_FOUND) {
      message = "authentication failed";
    } else if (ex.reason() == LoginFailureException.Reason.INTERNAL) {
      message = "login failed";
    } else if (ex.getCause() instanceof AccountIntegrationException) {
      message = "user lookup failed";
    } else {
      message = ex.getMessage();
    }
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  @ExceptionHandler(PermissionDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handlePermissionDenied(PermissionDeniedException ex) {
    final Operation operation = ex.operation();
    if (Operation.LOGIN.equals(operation)) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(new ApiErrorResponse("UNAUTHENTICATED", "login required"));
    }
    identityMetrics.recordPermissionDenied(
        operation == null || operation.isNone() ? "none" : operation.action().value());
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("PERMISSION_DENIED", ex.getMessage()));
  }
}
