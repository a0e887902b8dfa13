/*
 * どこで: Quota 外部連携
 * 何を: ドメイン登録結果(参照 ID、DNS レコード、即時検証フラグ)を表す
 * なぜ: プロバイダ固有の応答形式をワークフローへ持ち込まないため
 */
package com.notifyhub.quota.provider;

import com.notifyhub.quota.model.DnsRecord;
import java.util.List;

public record DomainAuthentication(String referenceId, List<DnsRecord> dnsRecords, boolean valid) {

  public DomainAuthentication {
    dnsRecords = List.copyOf(dnsRecords);
  }
}
