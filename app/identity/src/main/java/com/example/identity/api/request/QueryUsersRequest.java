package com.example.identity.api.request;

/** Searches users; every field is an optional filter. Timestamps are RFC 3339 strings. */
public record QueryUsersRequest(
    String externalId,
    String email,
    String lastLoginSince,
    String lastDischargeSince,
    String owner)
    implements ApiRequest {}
