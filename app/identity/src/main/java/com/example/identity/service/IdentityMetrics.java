/*
 * どこで: identity サービス層
 * 何を: IdP ごとのログイン結果と失敗理由のメトリクスを記録する
 * なぜ: 署名検証や account 連携の失敗増加を Prometheus から直接観測できるようにするため
 */
package com.example.identity.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IdentityMetrics {

  private static final String METRIC_LOGIN_TOTAL = "identity.login.total";
  private static final String METRIC_LOGIN_FAILURE_TOTAL = "identity.login.failure.total";
  private static final String METRIC_PERMISSION_DENIED_TOTAL = "identity.permission.denied.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> loginFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> permissionDeniedCounters =
      new ConcurrentHashMap<>();

  public IdentityMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String idp, String result) {
    final String key = idp + "|" + result;
    loginCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Login attempt outcomes by identity provider")
                    .tags(Tags.of("idp", idp, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordLoginFailure(String idp, String reason) {
    final String key = idp + "|" + reason;
    loginFailureCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_LOGIN_FAILURE_TOTAL)
                    .description("Login failures by identity provider and reason")
                    .tags(Tags.of("idp", idp, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPermissionDenied(String action) {
    permissionDeniedCounters
        .computeIfAbsent(
            action,
            ignored ->
                Counter.builder(METRIC_PERMISSION_DENIED_TOTAL)
                    .description("Requests denied by the request authorizer")
                    .tags(Tags.of("action", action))
                    .register(meterRegistry))
        .increment();
  }
}
