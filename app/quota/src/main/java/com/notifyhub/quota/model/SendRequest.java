/*
 * どこで: Quota ドメインモデル
 * 何を: 送信ジョブ投入時に判定する機能名と優先度を表す
 * なぜ: 送信可否判定の入力をジョブ投入側から受け取るため
 */
package com.notifyhub.quota.model;

import com.notifyhub.quota.plan.Features;

public record SendRequest(String feature, boolean priority) {

  public SendRequest {
    if (feature == null || feature.isBlank()) {
      feature = Features.EMAIL;
    }
  }

  public static SendRequest email() {
    return new SendRequest(Features.EMAIL, false);
  }

  public boolean isEmail() {
    return Features.EMAIL.equals(feature);
  }
}
