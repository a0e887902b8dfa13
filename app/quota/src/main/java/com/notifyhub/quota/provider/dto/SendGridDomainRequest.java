/*
 * どこで: Quota 外部連携 DTO
 * 何を: SendGrid のドメイン認証登録リクエストを表す
 * なぜ: snake_case の JSON を型で組み立てるため
 */
package com.notifyhub.quota.provider.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendGridDomainRequest(
    String domain,
    String subdomain,
    boolean automaticSecurity,
    @JsonProperty("default") boolean defaultDomain,
    boolean customSpf) {}
