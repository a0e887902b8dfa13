/*
 * どこで: Quota ドメインモデル
 * 何を: ドメイン登録要求の結果(状態、DNS レコード、設定手順)を表す
 * なぜ: 呼び出し側がそのままテナントへ案内を表示できるようにするため
 */
package com.notifyhub.quota.model;

import java.util.List;

public record DomainRequestResult(
    String domain,
    DomainState state,
    List<AnnotatedDnsRecord> dnsRecords,
    DomainSetupInstructions instructions,
    CleanupResult previousRegistrationCleanup) {

  public DomainRequestResult {
    dnsRecords = List.copyOf(dnsRecords);
  }

  public boolean verified() {
    return state == DomainState.VERIFIED;
  }
}
