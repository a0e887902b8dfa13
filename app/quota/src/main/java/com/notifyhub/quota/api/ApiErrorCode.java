/*
 * どこで: Quota API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.notifyhub.quota.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  PLAN_RESTRICTED,
  QUOTA_EXCEEDED,
  DOMAIN_CONFLICT,
  EXTERNAL_SERVICE_ERROR
}
