package com.example.identity.api.request;

import java.util.List;

/** Checks a serialized capability token set; the result names the token's user. */
public record VerifyTokenRequest(List<String> macaroons) implements ApiRequest {

  public VerifyTokenRequest {
    macaroons = macaroons == null ? List.of() : List.copyOf(macaroons);
  }
}
