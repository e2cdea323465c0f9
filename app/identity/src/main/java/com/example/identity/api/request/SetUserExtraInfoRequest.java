package com.example.identity.api.request;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record SetUserExtraInfoRequest(@NotBlank String username, Map<String, Object> extraInfo)
    implements ApiRequest {}
