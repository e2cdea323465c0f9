package com.example.identity.idp;

public class LoginFailureException extends RuntimeException {

  public enum Reason {
    BAD_REQUEST,
    TRANSPORT,
    INVALID_RESPONSE,
    REJECTED,
    MALFORMED_CREDENTIAL,
    USER_NOT_FOUND,
    INTERNAL
  }

  private final Reason reason;

  public LoginFailureException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public LoginFailureException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
