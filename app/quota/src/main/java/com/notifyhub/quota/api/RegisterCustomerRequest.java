/*
 * どこで: Quota API
 * 何を: サインアップ時の顧客登録入力を保持する
 * なぜ: 認証サービスが発行した ID で無料プランの行を作るため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterCustomerRequest(
    @NotBlank(message = "customer_id is required")
        @Size(max = 64, message = "customer_id must be at most 64 characters")
        String customerId) {}
