/*
 * どこで: Quota API
 * 何を: 月間送信上限に達したことを表す
 * なぜ: 次回リセット日時を添えて 429 を返すため
 */
package com.notifyhub.quota.api;

import java.time.Instant;

public class QuotaExceededException extends RuntimeException {

  private final Instant resetAt;

  public QuotaExceededException(int usage, int limit, Instant resetAt) {
    super(
        "Monthly usage limit exceeded ("
            + usage
            + "/"
            + limit
            + "). Upgrade your plan or wait for reset on "
            + resetAt
            + ".");
    this.resetAt = resetAt;
  }

  public Instant resetAt() {
    return resetAt;
  }
}
