/*
 * どこで: Quota サービス層
 * 何を: 送信許可/拒否、強制ダウングレード、プロバイダ呼び出しのメトリクスを記録する
 * なぜ: クォータ超過率やドメイン検証の失敗を運用で継続監視できるようにするため
 */
package com.notifyhub.quota.service;

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
public class QuotaMetrics {

  static final String METRIC_SEND_AUTHORIZATION = "quota.send.authorization.total";
  static final String METRIC_DOWNGRADE = "quota.downgrade.total";
  static final String METRIC_PROVIDER_CALL = "quota.domain.provider.total";
  static final String METRIC_ROLLOVER = "quota.billing.rollover.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public QuotaMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordSendAuthorization(String result) {
    increment(METRIC_SEND_AUTHORIZATION, "Send authorization decisions", Tags.of("result", result));
  }

  public void recordDowngrade(String reason) {
    increment(METRIC_DOWNGRADE, "Forced downgrades to the free plan", Tags.of("reason", reason));
  }

  public void recordProviderCall(String operation, String result) {
    increment(
        METRIC_PROVIDER_CALL,
        "Domain authentication provider calls",
        Tags.of("operation", operation, "result", result));
  }

  public void recordRollover(String outcome) {
    increment(METRIC_ROLLOVER, "Billing cycle rollover outcomes", Tags.of("outcome", outcome));
  }

  private void increment(String name, String description, Tags tags) {
    final StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append(':').append(tag.getKey()).append('=').append(tag.getValue()));
    counters
        .computeIfAbsent(
            key.toString(),
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
