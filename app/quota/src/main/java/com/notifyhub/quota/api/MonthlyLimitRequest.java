/*
 * どこで: Quota API
 * 何を: 管理者による月間上限の上書き入力を保持する
 * なぜ: 0 以下の上限を入口で弾くため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonthlyLimitRequest(
    @NotNull(message = "monthly_limit is required")
        @Positive(message = "monthly_limit must be greater than 0")
        Integer monthlyLimit) {}
