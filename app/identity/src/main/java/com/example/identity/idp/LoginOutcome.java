package com.example.identity.idp;

import com.example.identity.model.LocalUser;
import java.util.Objects;

/** Terminal result of one login attempt. */
public sealed interface LoginOutcome permits LoginOutcome.Success, LoginOutcome.Failure {

  static LoginOutcome success(LocalUser user) {
    return new Success(user);
  }

  static LoginOutcome failure(LoginFailureException cause) {
    return new Failure(cause);
  }

  record Success(LocalUser user) implements LoginOutcome {
    public Success {
      Objects.requireNonNull(user, "user is required");
    }
  }

  record Failure(LoginFailureException cause) implements LoginOutcome {
    public Failure {
      Objects.requireNonNull(cause, "cause is required");
    }
  }
}
