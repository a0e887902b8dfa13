/*
 * どこで: Quota API
 * 何を: テナント所有の送信プロバイダ API キーの登録入力を保持する
 * なぜ: 平文を受け取った直後に暗号化して保存するため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendCredentialRequest(@NotBlank(message = "api_key is required") String apiKey) {

  @Override
  public String toString() {
    return "SendCredentialRequest[apiKey=***]";
  }
}
