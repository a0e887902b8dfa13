/*
 * どこで: Quota サービス層
 * 何を: 課金サイクル期限を過ぎた顧客の使用量リセットまたはダウングレードを判断する
 * なぜ: 有料プランの契約切れに猶予期間を設けたうえで無料プランへ戻すため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.config.BillingCycleProperties;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.DowngradeReason;
import com.notifyhub.quota.model.RolloverOutcome;
import com.notifyhub.quota.model.SubscriptionStatus;
import com.notifyhub.quota.repository.CustomerRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BillingCycleService {

  private static final Logger logger = LoggerFactory.getLogger(BillingCycleService.class);

  private final CustomerRepository customerRepository;
  private final UsageTracker usageTracker;
  private final QuotaMetrics metrics;
  private final BillingCycleProperties properties;
  private final Clock clock;

  public RolloverOutcome rollOverIfDue(CustomerRecord customer) {
    final Instant now = Instant.now(clock);
    if (customer.usageResetAt().isAfter(now)) {
      return RolloverOutcome.NOT_DUE;
    }
    final RolloverOutcome outcome = decide(customer, now);
    switch (outcome) {
      case RESET, RESET_IN_GRACE_PERIOD -> {
        if (!usageTracker.resetMonthlyUsageIfDue(customer.id())) {
          // 別スレッド/別インスタンスが先にリセット済み
          return RolloverOutcome.NOT_DUE;
        }
      }
      case DOWNGRADED -> {
        final boolean downgraded =
            usageTracker.downgradeToFreePlan(customer.id(), DowngradeReason.SUBSCRIPTION_EXPIRED);
        if (!downgraded) {
          return RolloverOutcome.NOT_DUE;
        }
      }
      default -> throw new IllegalStateException("unexpected rollover outcome: " + outcome);
    }
    if (outcome == RolloverOutcome.RESET_IN_GRACE_PERIOD) {
      logger.warn(
          "customer in grace period customerId={} plan={} daysLeft={}",
          customer.id(),
          customer.plan(),
          graceDaysLeft(customer.subscriptionEndDate(), now));
    }
    metrics.recordRollover(outcome.name().toLowerCase(Locale.ROOT));
    return outcome;
  }

  /**
   * 期限を過ぎた顧客を 1 バッチ分処理する。
   *
   * @return 処理結果ごとの件数
   */
  public Map<RolloverOutcome, Integer> sweepDue() {
    final Instant now = Instant.now(clock);
    final List<String> dueIds =
        customerRepository.findIdsDueForRollover(now, properties.batchSize());
    final Map<RolloverOutcome, Integer> counts = new EnumMap<>(RolloverOutcome.class);
    int failed = 0;
    for (String customerId : dueIds) {
      try {
        final Optional<CustomerRecord> customer = customerRepository.findById(customerId);
        if (customer.isEmpty()) {
          continue;
        }
        counts.merge(rollOverIfDue(customer.get()), 1, Integer::sum);
      } catch (RuntimeException ex) {
        // 1 件の失敗でバッチ全体を止めず、次回のスイープで再試行する
        failed++;
        logger.warn("billing cycle rollover failed customerId={}", customerId, ex);
      }
    }
    if (!dueIds.isEmpty()) {
      logger.info(
          "billing cycle sweep processed due={} outcomes={} failed={}",
          dueIds.size(),
          counts,
          failed);
    }
    return counts;
  }

  RolloverOutcome decide(CustomerRecord customer, Instant now) {
    if (customer.plan() == CustomerPlan.FREE) {
      return RolloverOutcome.RESET;
    }
    final Instant endDate = customer.subscriptionEndDate();
    final boolean activeSubscription =
        customer.subscriptionStatus() == SubscriptionStatus.ACTIVE
            && endDate != null
            && endDate.isAfter(now);
    if (activeSubscription) {
      return RolloverOutcome.RESET;
    }
    if (endDate != null && !now.isAfter(endDate.plus(properties.gracePeriod()))) {
      return RolloverOutcome.RESET_IN_GRACE_PERIOD;
    }
    return RolloverOutcome.DOWNGRADED;
  }

  private long graceDaysLeft(Instant endDate, Instant now) {
    final Duration left = Duration.between(now, endDate.plus(properties.gracePeriod()));
    final long days = left.toDays();
    return left.minusDays(days).isZero() ? days : days + 1;
  }
}
