/*
 * どこで: Quota API
 * 何を: 使用量統計のレスポンスを表す
 * なぜ: ダッシュボード向けの JSON 形式を固定するため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.UsageStats;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UsageResponse(
    int usage,
    int limit,
    int remaining,
    Instant resetAt,
    Instant billingCycleStartAt,
    double percentageUsed) {

  public static UsageResponse from(UsageStats stats) {
    return new UsageResponse(
        stats.usage(),
        stats.limit(),
        stats.remaining(),
        stats.resetAt(),
        stats.billingCycleStartAt(),
        stats.percentageUsed());
  }
}
