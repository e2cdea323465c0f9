package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record ModifyUserGroupsRequest(
    @NotBlank String username, List<String> add, List<String> remove) implements ApiRequest {

  public ModifyUserGroupsRequest {
    add = add == null ? List.of() : List.copyOf(add);
    remove = remove == null ? List.of() : List.copyOf(remove);
  }
}
