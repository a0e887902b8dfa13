/*
 * どこで: Quota 外部連携 DTO
 * 何を: SendGrid のエラーレスポンス({"errors":[{"message":...}]})を表す
 * なぜ: プロバイダ側のエラーメッセージを例外へ添えるため
 */
package com.notifyhub.quota.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendGridErrorResponse(List<Error> errors) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Error(String field, String message) {}

  public String firstMessage() {
    if (errors == null || errors.isEmpty()) {
      return null;
    }
    return errors.get(0).message();
  }
}
