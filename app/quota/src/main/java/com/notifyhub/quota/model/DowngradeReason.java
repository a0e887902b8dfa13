/*
 * どこで: Quota ドメインモデル
 * 何を: FREE への強制ダウングレード理由を列挙する
 * なぜ: 監査ログとメトリクスに理由を残すため
 */
package com.notifyhub.quota.model;

public enum DowngradeReason {
  SUBSCRIPTION_EXPIRED,
  PAYMENT_FAILED
}
