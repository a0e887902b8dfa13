/*
 * どこで: Quota 機能ゲート
 * 何を: 許可/拒否と拒否理由を表す
 * なぜ: 例外を投げずに判定だけ欲しい呼び出し側にも理由を返すため
 */
package com.notifyhub.quota.plan;

public record GateDecision(String feature, boolean allowed, String reason) {

  public static GateDecision allow(String feature) {
    return new GateDecision(feature, true, null);
  }

  public static GateDecision deny(String feature, String reason) {
    return new GateDecision(feature, false, reason);
  }
}
