/*
 * どこで: Quota ドメインモデル
 * 何を: customers テーブル 1 行のスナップショットを表す
 * なぜ: 機能ゲート/使用量/ドメイン検証で同じ行表現を共有するため
 */
package com.notifyhub.quota.model;

import java.time.Instant;
import java.util.List;

public record CustomerRecord(
    String id,
    CustomerPlan plan,
    CustomerPlan previousPlan,
    int monthlyLimit,
    int usageCount,
    Instant usageResetAt,
    Instant billingCycleStartAt,
    boolean active,
    SubscriptionStatus subscriptionStatus,
    Instant subscriptionEndDate,
    Instant downgradedAt,
    String sendgridApiKey,
    String sendingDomain,
    boolean domainVerified,
    String domainProviderId,
    List<DnsRecord> domainDnsRecords,
    Instant domainRequestedAt,
    Instant domainVerifiedAt,
    Instant domainCheckedAt) {

  public CustomerRecord {
    domainDnsRecords = domainDnsRecords == null ? null : List.copyOf(domainDnsRecords);
  }

  public boolean hasSendCredential() {
    return sendgridApiKey != null && !sendgridApiKey.isBlank();
  }

  public DomainState domainState() {
    return DomainState.of(this);
  }
}
