/*
 * どこで: Quota 監査ログ
 * 何を: customer_audit.action の有効値を列挙する
 * なぜ: プラン/使用量/ドメインの変更履歴を種類別に追えるようにするため
 */
package com.notifyhub.quota.model;

// customer_audit の CHECK 制約と値を一致させる。
public enum AuditAction {
  CREATED,
  PLAN_CHANGED,
  DOWNGRADED,
  USAGE_RESET,
  USAGE_OVERRIDDEN,
  LIMIT_OVERRIDDEN,
  SUBSCRIPTION_UPDATED,
  CREDENTIAL_STORED,
  CREDENTIAL_CLEARED,
  DOMAIN_REQUESTED,
  DOMAIN_VERIFIED,
  DOMAIN_REMOVED
}
