/*
 * どこで: Quota API
 * 何を: ドメイン形式やプラン条件など入力起因の拒否を表す
 * なぜ: 外部呼び出しの前に BAD_REQUEST として返すため
 */
package com.notifyhub.quota.api;

public class InvalidQuotaRequestException extends RuntimeException {

  public InvalidQuotaRequestException(String message) {
    super(message);
  }
}
