package com.example.identity.auth;

public class PermissionDeniedException extends RuntimeException {

  private final transient Operation operation;

  public PermissionDeniedException(Operation operation) {
    super("permission denied");
    this.operation = operation;
  }

  public Operation operation() {
    return operation;
  }
}
