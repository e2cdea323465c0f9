package com.example.identity.api.response;

public record IdpDescriptor(String name, String description, boolean interactive) {}
