/*
 * どこで: identity の認可モデル
 * 何を: capability token が許可すべき (entity, action) の組
 * なぜ: API ごとの必要権限を外部の認可エンジンへ値として渡すため
 */
package com.example.identity.auth;

import java.util.Objects;

/**
 * The operation a caller must be authorized for before a request is served.
 *
 * <p>{@link #NONE} carries no action and is never satisfiable; it is what unknown requests resolve
 * to. {@link #LOGIN} only asserts that the caller is authenticated.
 */
public record Operation(String entity, Action action) {

  public static final String GLOBAL_ENTITY = "global";

  public static final Operation NONE = new Operation("", null);

  public static final Operation LOGIN = new Operation("login", Action.LOGIN);

  public Operation {
    Objects.requireNonNull(entity, "entity is required");
  }

  public static Operation global(Action action) {
    return new Operation(GLOBAL_ENTITY, Objects.requireNonNull(action, "action is required"));
  }

  public static Operation user(String username, Action action) {
    return new Operation(
        Objects.requireNonNull(username, "username is required"),
        Objects.requireNonNull(action, "action is required"));
  }

  public boolean isNone() {
    return action == null;
  }
}
