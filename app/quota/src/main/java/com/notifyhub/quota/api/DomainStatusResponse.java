/*
 * どこで: Quota API
 * 何を: 保存済み送信ドメインの状態レスポンスを表す
 * なぜ: 未設定時と設定済み時で同じエンドポイントから返すため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.DomainStatus;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainStatusResponse(
    boolean hasDomain,
    String domain,
    String status,
    Boolean verified,
    List<DnsRecordResponse> dnsRecords,
    Instant requestedAt,
    Instant verifiedAt,
    Instant checkedAt,
    String message) {

  public static DomainStatusResponse from(DomainStatus status) {
    if (!status.hasDomain()) {
      return new DomainStatusResponse(
          false, null, status.state().label(), null, null, null, null, null, status.message());
    }
    return new DomainStatusResponse(
        true,
        status.domain(),
        status.state().label(),
        status.verified(),
        DnsRecordResponse.fromAll(status.dnsRecords()),
        status.requestedAt(),
        status.verifiedAt(),
        status.checkedAt(),
        null);
  }
}
