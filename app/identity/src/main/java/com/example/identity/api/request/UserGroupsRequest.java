package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record UserGroupsRequest(@NotBlank String username) implements ApiRequest {}
