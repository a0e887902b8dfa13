/*
 * どこで: Quota ドメインモデル
 * 何を: サブスクリプションの料金プランを列挙する
 * なぜ: DB の CHECK 制約と同じ値をアプリ側でも型として扱うため
 */
package com.notifyhub.quota.model;

public enum CustomerPlan {
  FREE,
  INDIE,
  STARTUP;

  public boolean isPaid() {
    return this != FREE;
  }
}
