package com.example.identity.api.response;

public record LoginResponse(String userId, String username) {}
