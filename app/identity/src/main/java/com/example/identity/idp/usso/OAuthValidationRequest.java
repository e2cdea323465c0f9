package com.example.identity.idp.usso;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of the validator's {@code requests/validate} call; field names are the validator's. */
public record OAuthValidationRequest(
    @JsonProperty("http_url") String httpUrl,
    @JsonProperty("http_method") String httpMethod,
    @JsonProperty("authorization") String authorization,
    @JsonProperty("query_string") String queryString) {}
