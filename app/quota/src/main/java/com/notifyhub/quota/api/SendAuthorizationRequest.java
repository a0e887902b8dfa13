/*
 * どこで: Quota API
 * 何を: 送信可否判定の入力を保持する
 * なぜ: ジョブ投入側が機能名と優先度を指定できるようにするため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.SendRequest;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendAuthorizationRequest(String feature, boolean priority) {

  public SendRequest toSendRequest() {
    return new SendRequest(feature, priority);
  }
}
