package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record SetUserGroupsRequest(@NotBlank String username, List<String> groups)
    implements ApiRequest {

  public SetUserGroupsRequest {
    groups = groups == null ? List.of() : List.copyOf(groups);
  }
}
