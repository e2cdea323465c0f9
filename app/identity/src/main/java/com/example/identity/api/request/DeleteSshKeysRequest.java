package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record DeleteSshKeysRequest(@NotBlank String username, List<String> sshKeys)
    implements ApiRequest {

  public DeleteSshKeysRequest {
    sshKeys = sshKeys == null ? List.of() : List.copyOf(sshKeys);
  }
}
