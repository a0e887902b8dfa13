/*
 * どこで: Quota 機能ゲート
 * 何を: ゲート判定に必要なテナント状態だけを保持する
 * なぜ: 判定を DB やネットワークに触れない純粋関数にするため
 */
package com.notifyhub.quota.plan;

import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;

/**
 * ゲート判定の入力。
 *
 * <p>{@code sendCredential} は復号済みの値を渡す。暗号文のままでは空判定ができない。
 */
public record GateContext(
    CustomerPlan plan, String sendCredential, String sendingDomain, boolean domainVerified) {

  public static GateContext of(CustomerRecord customer, String decryptedCredential) {
    return new GateContext(
        customer.plan(),
        decryptedCredential,
        customer.sendingDomain(),
        customer.domainVerified());
  }

  public static GateContext ofPlan(CustomerPlan plan) {
    return new GateContext(plan, null, null, false);
  }

  public boolean hasSendCredential() {
    return sendCredential != null && !sendCredential.isBlank();
  }

  public boolean hasSendingDomain() {
    return sendingDomain != null && !sendingDomain.isBlank();
  }
}
