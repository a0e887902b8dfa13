/*
 * どこで: Quota API
 * 何を: 無料プランへの強制ダウングレード入力を保持する
 * なぜ: 理由を必須にして監査ログへ残すため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.DowngradeReason;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DowngradeRequest(@NotNull(message = "reason is required") DowngradeReason reason) {}
