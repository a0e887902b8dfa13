/*
 * どこで: DomainVerificationResult のユニットテスト
 * 何を: レコード別詳細が呼び出し側の Map から切り離されることを検証する
 * なぜ: 返却後の結果が外部の変更で書き換わらないことを保証するため
 */
package com.notifyhub.quota.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DomainVerificationResultTest {

  @Test
  void validationResultsAreCopiedInOrder() {
    final Map<String, DomainVerificationResult.RecordCheck> source = new LinkedHashMap<>();
    source.put("mail_cname", new DomainVerificationResult.RecordCheck(false, "missing"));
    source.put("dkim1", new DomainVerificationResult.RecordCheck(true, null));

    final DomainVerificationResult result =
        new DomainVerificationResult(
            "mail.example.com",
            false,
            DomainState.PENDING,
            DomainVerificationResult.MESSAGE_NOT_VERIFIED,
            source);
    source.put("dkim2", new DomainVerificationResult.RecordCheck(false, "missing"));
    source.remove("mail_cname");

    assertThat(result.validationResults()).containsOnlyKeys("mail_cname", "dkim1");
    assertThat(result.validationResults().keySet()).containsExactly("mail_cname", "dkim1");
    assertThatThrownBy(() -> result.validationResults().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void verifiedResultHasNoDetails() {
    final DomainVerificationResult result =
        new DomainVerificationResult(
            "mail.example.com",
            true,
            DomainState.VERIFIED,
            DomainVerificationResult.MESSAGE_VERIFIED,
            null);

    assertThat(result.validationResults()).isNull();
  }
}
