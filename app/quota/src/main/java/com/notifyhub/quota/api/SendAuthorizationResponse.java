/*
 * どこで: Quota API
 * 何を: 送信許可の結果レスポンスを表す
 * なぜ: 復号済みの認証情報を HTTP に載せず、共有認証情報を使うかだけを返すため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.SendAuthorization;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendAuthorizationResponse(
    String customerId,
    String plan,
    boolean usesSharedCredential,
    String sendingDomain,
    boolean priority,
    int remaining) {

  public static SendAuthorizationResponse from(SendAuthorization authorization) {
    return new SendAuthorizationResponse(
        authorization.customerId(),
        authorization.plan().name(),
        authorization.usesSharedCredential(),
        authorization.sendingDomain(),
        authorization.priority(),
        authorization.remaining());
  }
}
