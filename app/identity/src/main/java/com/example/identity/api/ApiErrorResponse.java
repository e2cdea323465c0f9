package com.example.identity.api;

public record ApiErrorResponse(String code, String message) {}
