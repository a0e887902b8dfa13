/*
 * どこで: Quota ドメインモデル
 * 何を: 使用量と残量、課金サイクル境界をまとめた読み取り結果を表す
 * なぜ: ダッシュボードと送信可否判定で同じ計算結果を使うため
 */
package com.notifyhub.quota.model;

import java.time.Instant;

public record UsageStats(
    int usage,
    int limit,
    int remaining,
    double percentageUsed,
    Instant resetAt,
    Instant billingCycleStartAt) {}
