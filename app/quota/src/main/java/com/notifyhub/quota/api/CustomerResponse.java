/*
 * どこで: Quota API
 * 何を: 顧客のプラン/使用量/ドメイン状態のレスポンスを表す
 * なぜ: 暗号文を含めずに管理操作の結果を返すため
 */
package com.notifyhub.quota.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.quota.model.CustomerRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerResponse(
    String id,
    String plan,
    String previousPlan,
    int monthlyLimit,
    int usageCount,
    Instant usageResetAt,
    Instant billingCycleStartAt,
    boolean active,
    String subscriptionStatus,
    Instant subscriptionEndDate,
    Instant downgradedAt,
    boolean hasSendCredential,
    String sendingDomain,
    String domainStatus) {

  public static CustomerResponse from(CustomerRecord customer) {
    return new CustomerResponse(
        customer.id(),
        customer.plan().name(),
        customer.previousPlan() == null ? null : customer.previousPlan().name(),
        customer.monthlyLimit(),
        customer.usageCount(),
        customer.usageResetAt(),
        customer.billingCycleStartAt(),
        customer.active(),
        customer.subscriptionStatus() == null ? null : customer.subscriptionStatus().name(),
        customer.subscriptionEndDate(),
        customer.downgradedAt(),
        customer.hasSendCredential(),
        customer.sendingDomain(),
        customer.domainState().label());
  }
}
