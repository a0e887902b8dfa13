/*
 * どこで: Quota 課金サイクルワーカー
 * 何を: 期限を過ぎた顧客のロールオーバーをスケジュールで起動する
 * なぜ: 送信リクエストが来ない顧客もサイクル境界でリセット/ダウングレードするため
 */
package com.notifyhub.quota.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "quota.billing-cycle.enabled", havingValue = "true")
public class BillingCycleWorker {

  private final BillingCycleService billingCycleService;

  @Scheduled(fixedDelayString = "${quota.billing-cycle.sweep-interval}")
  public void run() {
    billingCycleService.sweepDue();
  }
}
