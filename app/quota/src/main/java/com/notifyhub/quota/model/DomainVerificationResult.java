/*
 * どこで: Quota ドメインモデル
 * 何を: 検証確認の結果と未検証時のレコード別詳細を表す
 * なぜ: どの DNS レコードが未反映かをテナントへ示すため
 */
package com.notifyhub.quota.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DomainVerificationResult(
    String domain,
    boolean verified,
    DomainState state,
    String message,
    Map<String, RecordCheck> validationResults) {

  public static final String MESSAGE_VERIFIED =
      "Domain verified! You can now send emails from this domain.";
  public static final String MESSAGE_NOT_VERIFIED =
      "Domain not yet verified. DNS records may still be propagating (15-60 minutes).";

  public DomainVerificationResult {
    // レコード名の並びは保ったまま呼び出し側の Map から切り離す
    validationResults =
        validationResults == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(validationResults));
  }

  public record RecordCheck(boolean valid, String reason) {}
}
