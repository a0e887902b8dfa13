/*
 * どこで: Quota ドメインモデル
 * 何を: 古いプロバイダ登録の削除を試みた結果を表す
 * なぜ: 削除失敗を処理中断にせず、結果としてログと応答に残すため
 */
package com.notifyhub.quota.model;

public record CleanupResult(
    String referenceId, boolean attempted, boolean succeeded, String failureMessage) {

  public static CleanupResult notNeeded() {
    return new CleanupResult(null, false, false, null);
  }

  public static CleanupResult succeeded(String referenceId) {
    return new CleanupResult(referenceId, true, true, null);
  }

  public static CleanupResult failed(String referenceId, String failureMessage) {
    return new CleanupResult(referenceId, true, false, failureMessage);
  }
}
