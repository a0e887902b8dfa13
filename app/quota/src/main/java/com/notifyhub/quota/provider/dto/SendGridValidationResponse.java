/*
 * どこで: Quota 外部連携 DTO
 * 何を: SendGrid のドメイン検証レスポンスを表す
 * なぜ: レコード単位の検証理由をそのまま呼び出し側へ渡すため
 */
package com.notifyhub.quota.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendGridValidationResponse(
    Long id, Boolean valid, Map<String, ValidationResult> validationResults) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ValidationResult(Boolean valid, String reason) {}
}
