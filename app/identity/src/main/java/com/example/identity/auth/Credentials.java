package com.example.identity.auth;

import com.example.identity.model.LocalUser;
import java.util.List;
import java.util.Optional;

/**
 * What a caller presented with a request: the user of an authenticated session, if any, and the
 * serialized capability tokens.
 */
public record Credentials(LocalUser user, List<String> tokens) {

  public Credentials {
    tokens = tokens == null ? List.of() : List.copyOf(tokens);
  }

  public static Credentials anonymous() {
    return new Credentials(null, List.of());
  }

  public static Credentials authenticated(LocalUser user) {
    return new Credentials(user, List.of());
  }

  public Optional<LocalUser> authenticatedUser() {
    return Optional.ofNullable(user);
  }
}
