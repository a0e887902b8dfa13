/*
 * どこで: Quota API
 * 何を: ドメイン登録結果(状態、DNS レコード、設定手順)のレスポンスを表す
 * なぜ: テナントへ表示する案内をそのまま返すため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.DomainRequestResult;
import com.notifyhub.quota.model.DomainSetupInstructions;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DomainRequestResponse(
    String domain, String status, List<DnsRecordResponse> dnsRecords, Instructions instructions) {

  public static DomainRequestResponse from(DomainRequestResult result) {
    final DomainSetupInstructions instructions = result.instructions();
    return new DomainRequestResponse(
        result.domain(),
        result.state().label(),
        DnsRecordResponse.fromAll(result.dnsRecords()),
        new Instructions(
            instructions.message(), instructions.steps(), instructions.estimatedTime()));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Instructions(String message, List<String> steps, String estimatedTime) {}
}
