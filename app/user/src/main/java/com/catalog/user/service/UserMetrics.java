/*
 * どこで: User サービス層
 * 何を: ユーザー解決の結果と identity ヘッダー拒否の件数を記録する
 * なぜ: 新規作成の急増やバックエンド障害を Prometheus から観測できるようにするため
 */
package com.catalog.user.service;

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
public class UserMetrics {

  private static final String METRIC_RESOLUTION_TOTAL = "user.resolution.total";
  private static final String METRIC_IDENTITY_REJECTED_TOTAL = "user.identity.rejected.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> resolutionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();

  public UserMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordResolution(String result) {
    resolutionCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_RESOLUTION_TOTAL)
                    .description("User resolve-or-create outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRejection(UserValidationException.Reason reason) {
    rejectionCounters
        .computeIfAbsent(
            reason.name(),
            ignored ->
                Counter.builder(METRIC_IDENTITY_REJECTED_TOTAL)
                    .description("Requests rejected by the identity filter by reason")
                    .tags(Tags.of("reason", reason.name()))
                    .register(meterRegistry))
        .increment();
  }
}
