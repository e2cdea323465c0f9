package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserRequest(@NotBlank String username) implements ApiRequest {}
