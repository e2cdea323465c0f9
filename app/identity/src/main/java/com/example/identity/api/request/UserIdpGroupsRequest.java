package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserIdpGroupsRequest(@NotBlank String username) implements ApiRequest {}
