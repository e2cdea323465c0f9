package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record SshKeysRequest(@NotBlank String username) implements ApiRequest {}
