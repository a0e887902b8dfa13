/*
 * どこで: Quota ドメインモデル
 * 何を: 決済プロバイダ由来のサブスクリプション状態を列挙する
 * なぜ: 課金サイクル切替時の猶予判定に使うため
 */
package com.notifyhub.quota.model;

public enum SubscriptionStatus {
  ACTIVE,
  PAST_DUE,
  CANCELLED,
  EXPIRED,
  TRIALING
}
