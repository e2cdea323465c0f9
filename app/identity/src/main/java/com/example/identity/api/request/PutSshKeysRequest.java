package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/** Stores SSH keys; {@code add} appends instead of replacing the current set. */
public record PutSshKeysRequest(@NotBlank String username, List<String> sshKeys, boolean add)
    implements ApiRequest {

  public PutSshKeysRequest {
    sshKeys = sshKeys == null ? List.of() : List.copyOf(sshKeys);
  }
}
