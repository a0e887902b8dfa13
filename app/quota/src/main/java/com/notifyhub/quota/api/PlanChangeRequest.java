/*
 * どこで: Quota API
 * 何を: 管理者によるプラン変更の入力を保持する
 * なぜ: 列挙値以外のプランをバインド時に弾くため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.CustomerPlan;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlanChangeRequest(@NotNull(message = "plan is required") CustomerPlan plan) {}
