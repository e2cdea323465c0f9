package com.example.identity.api.response;

import java.util.List;

public record WhoAmIResponse(String userId, String username, List<String> roles) {

  public WhoAmIResponse {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
