/*
 * どこで: Quota アプリの設定バインド
 * 何を: 課金サイクル長、猶予期間、定期スイープの設定を保持する
 * なぜ: リセット間隔と猶予日数を運用で調整できるようにするため
 */
package com.notifyhub.quota.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "quota.billing-cycle")
public record BillingCycleProperties(
    boolean enabled,
    @NotNull Duration cycleLength,
    @NotNull Duration gracePeriod,
    @NotNull Duration sweepInterval,
    @Min(1) int batchSize) {}
