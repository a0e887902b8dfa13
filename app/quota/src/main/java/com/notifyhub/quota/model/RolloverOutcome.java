/*
 * どこで: Quota ドメインモデル
 * 何を: 課金サイクル境界での処理結果を表す
 * なぜ: 定期スイープと送信経路で同じ判定結果をログ/メトリクスに出すため
 */
package com.notifyhub.quota.model;

public enum RolloverOutcome {
  NOT_DUE,
  RESET,
  RESET_IN_GRACE_PERIOD,
  DOWNGRADED
}
