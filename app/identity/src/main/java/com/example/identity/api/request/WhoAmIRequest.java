package com.example.identity.api.request;

/** Asks who the authenticated caller is. Carries no fields. */
public record WhoAmIRequest() implements ApiRequest {}
