package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserExtraInfoItemRequest(@NotBlank String username, @NotBlank String item)
    implements ApiRequest {}
