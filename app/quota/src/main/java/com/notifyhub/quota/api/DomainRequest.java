/*
 * どこで: Quota API
 * 何を: 送信ドメイン登録リクエストの入力を保持する
 * なぜ: JSON からのバインドと必須チェックを明確にするため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DomainRequest(@NotBlank(message = "domain is required") String domain) {}
