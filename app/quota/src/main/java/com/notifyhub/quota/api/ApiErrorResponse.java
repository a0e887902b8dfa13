/*
 * どこで: Quota API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: 呼び出し側がリトライ可否を code で判断できるようにするため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(ApiErrorCode code, String message, Boolean retryable) {

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null);
  }
}
