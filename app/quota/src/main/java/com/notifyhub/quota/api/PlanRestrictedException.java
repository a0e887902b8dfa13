/*
 * どこで: Quota API
 * 何を: プランにより機能が使えないことを表す
 * なぜ: テナント向けのアップグレード案内を message に載せて返すため
 */
package com.notifyhub.quota.api;

public class PlanRestrictedException extends RuntimeException {

  private final String feature;

  public PlanRestrictedException(String feature, String message) {
    super(message);
    this.feature = feature;
  }

  public String feature() {
    return feature;
  }
}
