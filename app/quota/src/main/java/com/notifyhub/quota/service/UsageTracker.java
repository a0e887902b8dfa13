/*
 * どこで: Quota サービス層
 * 何を: 送信数カウンタの加算/参照/リセットと強制ダウングレードを担う
 * なぜ: 課金サイクル境界と使用量の整合性を一箇所で保つため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.api.QuotaConfigurationException;
import com.notifyhub.quota.api.ResourceNotFoundException;
import com.notifyhub.quota.config.BillingCycleProperties;
import com.notifyhub.quota.model.AuditAction;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.DowngradeReason;
import com.notifyhub.quota.model.SubscriptionStatus;
import com.notifyhub.quota.model.UsageStats;
import com.notifyhub.quota.plan.PlanCatalog;
import com.notifyhub.quota.repository.CustomerRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class UsageTracker {

  private static final Logger logger = LoggerFactory.getLogger(UsageTracker.class);

  private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

  private final CustomerRepository customerRepository;
  private final CustomerAuditor auditor;
  private final QuotaMetrics metrics;
  private final BillingCycleProperties billingCycleProperties;
  private final Clock clock;

  /** 1 件加算する。上限判定は呼び出し側の責務で、ここでは拒否しない。 */
  public void incrementUsage(String customerId) {
    final int updated = customerRepository.incrementUsage(customerId, Instant.now(clock));
    if (updated == 0) {
      throw ResourceNotFoundException.customer(customerId);
    }
  }

  /**
   * 上限未満のときだけ 1 件加算する。
   *
   * @return 加算した場合 true。上限に達していれば false
   */
  public boolean tryConsume(String customerId) {
    if (customerRepository.incrementUsageWithinLimit(customerId, Instant.now(clock)) == 1) {
      return true;
    }
    findCustomer(customerId);
    return false;
  }

  public UsageStats getUsageStats(String customerId) {
    return statsOf(findCustomer(customerId));
  }

  public UsageStats statsOf(CustomerRecord customer) {
    final int limit = customer.monthlyLimit();
    if (limit <= 0) {
      throw new QuotaConfigurationException(
          "monthly limit must be positive for customer " + customer.id() + ": " + limit);
    }
    final int usage = customer.usageCount();
    final BigDecimal percentage =
        BigDecimal.valueOf(usage)
            .multiply(ONE_HUNDRED)
            .divide(BigDecimal.valueOf(limit), 2, RoundingMode.HALF_UP);
    return new UsageStats(
        usage,
        limit,
        Math.max(0, limit - usage),
        percentage.doubleValue(),
        customer.usageResetAt(),
        customer.billingCycleStartAt());
  }

  /** 呼び出し時刻から新しいサイクルを開始する。再実行するとサイクルが延びる。 */
  @Transactional
  public void resetMonthlyUsage(String customerId) {
    final Instant now = Instant.now(clock);
    final Instant nextResetAt = now.plus(billingCycleProperties.cycleLength());
    if (customerRepository.resetUsage(customerId, now, nextResetAt) == 0) {
      throw ResourceNotFoundException.customer(customerId);
    }
    auditor.record(
        customerId,
        AuditAction.USAGE_RESET,
        "manual",
        Map.of("reset_at", nextResetAt.toString()),
        now);
    logger.info("monthly usage reset customerId={} resetAt={}", customerId, nextResetAt);
  }

  /**
   * リセット期限を過ぎている場合だけリセットする。
   *
   * @return リセットした場合 true。同じサイクル内の再実行は false
   */
  @Transactional
  public boolean resetMonthlyUsageIfDue(String customerId) {
    final Instant now = Instant.now(clock);
    final Instant nextResetAt = now.plus(billingCycleProperties.cycleLength());
    if (customerRepository.resetUsageIfDue(customerId, now, nextResetAt) == 0) {
      findCustomer(customerId);
      logger.debug("monthly usage reset skipped, not due customerId={}", customerId);
      return false;
    }
    auditor.record(
        customerId,
        AuditAction.USAGE_RESET,
        "scheduled",
        Map.of("reset_at", nextResetAt.toString()),
        now);
    logger.info("monthly usage rolled over customerId={} resetAt={}", customerId, nextResetAt);
    return true;
  }

  /**
   * 無料プランへ強制的に戻す。
   *
   * @return ダウングレードした場合 true。既に FREE かつ EXPIRED なら何もせず false
   */
  @Transactional
  public boolean downgradeToFreePlan(String customerId, DowngradeReason reason) {
    if (reason == null) {
      throw new IllegalArgumentException("reason is required");
    }
    final CustomerRecord customer =
        customerRepository
            .findByIdForUpdate(customerId)
            .orElseThrow(() -> ResourceNotFoundException.customer(customerId));
    if (customer.plan() == CustomerPlan.FREE
        && customer.subscriptionStatus() == SubscriptionStatus.EXPIRED) {
      logger.info("downgrade skipped, already on expired free plan customerId={}", customerId);
      return false;
    }
    final Instant now = Instant.now(clock);
    final Instant nextResetAt = now.plus(billingCycleProperties.cycleLength());
    // previous_plan はプランが実際に変わるときだけ書き換える
    final CustomerPlan previousPlan =
        customer.plan() == CustomerPlan.FREE ? customer.previousPlan() : customer.plan();
    customerRepository.downgradeToFree(
        customerId,
        previousPlan,
        PlanCatalog.monthlyLimit(CustomerPlan.FREE),
        now,
        nextResetAt);
    final Map<String, Object> detail = new HashMap<>();
    detail.put("previous_plan", customer.plan().name());
    detail.put("previous_limit", customer.monthlyLimit());
    detail.put("previous_usage", customer.usageCount());
    auditor.record(customerId, AuditAction.DOWNGRADED, reason.name(), detail, now);
    metrics.recordDowngrade(reason.name().toLowerCase(Locale.ROOT));
    logger.warn(
        "customer downgraded to free plan customerId={} previousPlan={} reason={}",
        customerId,
        customer.plan(),
        reason);
    return true;
  }

  private CustomerRecord findCustomer(String customerId) {
    return customerRepository
        .findById(customerId)
        .orElseThrow(() -> ResourceNotFoundException.customer(customerId));
  }
}
