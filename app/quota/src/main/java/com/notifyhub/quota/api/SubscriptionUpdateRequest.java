/*
 * どこで: Quota API
 * 何を: 管理者によるサブスクリプション状態更新の入力を保持する
 * なぜ: 猶予期間判定に使う状態と終了日時を明示的に受け付けるため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.SubscriptionStatus;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionUpdateRequest(
    @NotNull(message = "subscription_status is required") SubscriptionStatus subscriptionStatus,
    Instant subscriptionEndDate) {}
