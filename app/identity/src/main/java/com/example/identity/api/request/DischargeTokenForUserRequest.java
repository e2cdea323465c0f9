package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record DischargeTokenForUserRequest(@NotBlank String username) implements ApiRequest {}
