package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record SetUserExtraInfoItemRequest(
    @NotBlank String username, @NotBlank String item, Object data) implements ApiRequest {}
