/*
 * どこで: Quota 外部連携 DTO
 * 何を: SendGrid のドメイン認証登録レスポンスを表す
 * なぜ: 必要なフィールドだけを型付きで読み取るため
 */
package com.notifyhub.quota.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendGridDomainResponse(Long id, String domain, Boolean valid, Dns dns) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Dns(DnsEntry mailCname, DnsEntry dkim1, DnsEntry dkim2) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DnsEntry(String type, String host, String data, Boolean valid) {}
}
