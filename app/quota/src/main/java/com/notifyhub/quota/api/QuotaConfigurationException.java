/*
 * どこで: Quota 設定
 * 何を: 起動前提を満たさない設定(暗号鍵、上限値)を表す
 * なぜ: 設定不備を実行時のリクエスト失敗ではなく起動失敗として扱うため
 */
package com.notifyhub.quota.api;

public class QuotaConfigurationException extends IllegalStateException {

  public QuotaConfigurationException(String message) {
    super(message);
  }

  public QuotaConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
