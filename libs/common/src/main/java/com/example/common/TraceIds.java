package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  /** Request id used when the caller did not send {@code X-Request-Id}. */
  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static boolean isPresent(String id) {
    return id != null && !id.isBlank();
  }
}
