/*
 * どこで: Quota API
 * 何を: 管理者による使用量リセットの入力を保持する
 * なぜ: 値指定がなければ通常のサイクルリセット、指定があれば上書きとして扱うため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UsageResetRequest(
    @Min(value = 0, message = "usage_count must be greater than or equal to 0")
        Integer usageCount) {}
