package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserTokenRequest(@NotBlank String username) implements ApiRequest {}
