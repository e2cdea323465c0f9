package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Creates or replaces a user.
 *
 * <p>{@code owner} is set when an agent user is created on behalf of another user.
 */
public record SetUserRequest(
    @NotBlank String username,
    String owner,
    String fullName,
    String email,
    List<String> groups,
    List<String> publicKeys)
    implements ApiRequest {

  public SetUserRequest {
    groups = groups == null ? List.of() : List.copyOf(groups);
    publicKeys = publicKeys == null ? List.of() : List.copyOf(publicKeys);
  }

  public SetUserRequest(String username, String owner) {
    this(username, owner, null, null, List.of(), List.of());
  }

  public boolean hasOwner() {
    return owner != null && !owner.isEmpty();
  }
}
