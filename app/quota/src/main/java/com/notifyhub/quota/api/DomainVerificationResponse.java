/*
 * どこで: Quota API
 * 何を: ドメイン検証確認の結果を表す
 * なぜ: 未検証時にレコード別の詳細を返すため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.DomainVerificationResult;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DomainVerificationResponse(
    String domain,
    boolean verified,
    String status,
    String message,
    Map<String, DomainVerificationResult.RecordCheck> validationResults) {

  public static DomainVerificationResponse from(DomainVerificationResult result) {
    return new DomainVerificationResponse(
        result.domain(),
        result.verified(),
        result.state().label(),
        result.message(),
        result.validationResults());
  }
}
