package com.example.identity.idp.usso;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthValidationResponse(
    @JsonProperty("is_valid") boolean valid, @JsonProperty("error") String error) {

  public boolean hasError() {
    return error != null && !error.isEmpty();
  }
}
