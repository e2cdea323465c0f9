package com.example.identity.idp;

import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Per-attempt state of a login callback.
 *
 * @param requestUrl full URL the callback arrived on, query string included
 * @param params query and form parameters of the callback
 * @param waitId correlation token linking the callback to the login start, or {@code null}
 */
public record LoginContext(
    String requestUrl,
    String method,
    HttpHeaders headers,
    MultiValueMap<String, String> params,
    String waitId) {

  public LoginContext {
    Objects.requireNonNull(requestUrl, "requestUrl is required");
    Objects.requireNonNull(method, "method is required");
    headers = headers == null ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(headers);
    params = params == null ? new LinkedMultiValueMap<>() : new LinkedMultiValueMap<>(params);
  }

  /** The {@code Authorization} header, or an empty string when absent. */
  public String authorization() {
    final String value = headers.getFirst(HttpHeaders.AUTHORIZATION);
    return value == null ? "" : value;
  }
}
