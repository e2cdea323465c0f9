package com.example.identity.service.dto;

import java.util.List;

public record AccountUserResponse(
    String userId, String username, String accountStatus, List<String> roles) {}
