/*
 * どこで: Quota API
 * 何を: 他テナントが同じ送信ドメインを検証済みであることを表す
 * なぜ: 検証済みドメインの一意性違反を 409 として返すため
 */
package com.notifyhub.quota.api;

public class DomainConflictException extends RuntimeException {

  public DomainConflictException(String domain) {
    super("This domain is already verified by another customer: " + domain);
  }

  public DomainConflictException(String domain, Throwable cause) {
    super("This domain is already verified by another customer: " + domain, cause);
  }
}
