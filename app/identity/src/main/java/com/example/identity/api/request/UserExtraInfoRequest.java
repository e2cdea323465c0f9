package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserExtraInfoRequest(@NotBlank String username) implements ApiRequest {}
