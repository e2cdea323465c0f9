package com.example.identity.service.dto;

public record ExternalIdLookupRequest(String externalId) {}
