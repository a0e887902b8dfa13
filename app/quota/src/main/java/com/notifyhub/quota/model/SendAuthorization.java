/*
 * どこで: Quota ドメインモデル
 * 何を: 送信許可の結果(使う認証情報、送信ドメイン、残量)を表す
 * なぜ: ジョブ実行側が追加の参照なしに送信できるようにするため
 */
package com.notifyhub.quota.model;

/**
 * 送信許可。
 *
 * <p>{@code credential} が null の場合は運用側の共有認証情報で送る。
 */
public record SendAuthorization(
    String customerId,
    CustomerPlan plan,
    String credential,
    String sendingDomain,
    boolean priority,
    int remaining) {

  public boolean usesSharedCredential() {
    return credential == null;
  }

  @Override
  public String toString() {
    return "SendAuthorization[customerId="
        + customerId
        + ", plan="
        + plan
        + ", credential="
        + (credential == null ? "shared" : "***")
        + ", sendingDomain="
        + sendingDomain
        + ", priority="
        + priority
        + ", remaining="
        + remaining
        + "]";
  }
}
