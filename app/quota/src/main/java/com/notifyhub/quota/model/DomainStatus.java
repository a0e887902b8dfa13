/*
 * どこで: Quota ドメインモデル
 * 何を: 保存済みの送信ドメイン情報を読み取り専用で表す
 * なぜ: 外部呼び出しなしで現在の検証状態を返すため
 */
package com.notifyhub.quota.model;

import java.time.Instant;
import java.util.List;

public record DomainStatus(
    String domain,
    DomainState state,
    boolean verified,
    List<AnnotatedDnsRecord> dnsRecords,
    Instant requestedAt,
    Instant verifiedAt,
    Instant checkedAt,
    String message) {

  public static final String MESSAGE_NONE = "No custom domain configured";

  public static DomainStatus none() {
    return new DomainStatus(
        null, DomainState.NONE, false, List.of(), null, null, null, MESSAGE_NONE);
  }

  public static DomainStatus of(CustomerRecord customer) {
    final DomainState state = customer.domainState();
    if (state == DomainState.NONE) {
      return none();
    }
    return new DomainStatus(
        customer.sendingDomain(),
        state,
        customer.domainVerified(),
        AnnotatedDnsRecord.annotate(customer.domainDnsRecords()),
        customer.domainRequestedAt(),
        customer.domainVerifiedAt(),
        customer.domainCheckedAt(),
        null);
  }

  public boolean hasDomain() {
    return state != DomainState.NONE;
  }
}
