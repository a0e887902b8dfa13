/*
 * どこで: Quota プラン定義
 * 何を: プラン -> 上限値の静的な対応表を提供する
 * なぜ: FeatureGate と UsageTracker が同じ値を参照するため
 */
package com.notifyhub.quota.plan;

import com.notifyhub.quota.model.CustomerPlan;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

public final class PlanCatalog {

  /** 表の値を変えたら更新する。監査ログの detail に残る。 */
  public static final String VERSION = "2026-02";

  private static final Map<CustomerPlan, PlanLimits> LIMITS;

  static {
    final Map<CustomerPlan, PlanLimits> limits = new EnumMap<>(CustomerPlan.class);
    limits.put(
        CustomerPlan.FREE,
        new PlanLimits(
            "Free",
            100,
            5,
            OptionalInt.of(14),
            BigDecimal.ZERO,
            false,
            List.of(
                "100 notifications/month",
                "Shared email infrastructure",
                "Basic delivery monitoring",
                "Webhook support",
                "14-day log retention",
                "Community support")));
    limits.put(
        CustomerPlan.INDIE,
        new PlanLimits(
            "Indie",
            3000,
            100,
            OptionalInt.of(90),
            new BigDecimal("9"),
            true,
            List.of(
                "3,000 notifications/month",
                "Bring your own API key",
                "Managed domain verification",
                "Webhook management",
                "Advanced delivery monitoring",
                "90-day log retention",
                "Custom email templates",
                "Priority support")));
    limits.put(
        CustomerPlan.STARTUP,
        new PlanLimits(
            "Startup",
            15000,
            500,
            OptionalInt.empty(),
            new BigDecimal("39"),
            true,
            List.of(
                "15,000 notifications/month",
                "Bring your own API key",
                "Managed domain verification",
                "Webhook management",
                "Advanced monitoring & analytics",
                "Unlimited log retention",
                "Scheduled notifications",
                "Dedicated support",
                "Higher rate limits")));
    LIMITS = Collections.unmodifiableMap(limits);
  }

  private PlanCatalog() {}

  public static PlanLimits limits(CustomerPlan plan) {
    final PlanLimits limits = LIMITS.get(plan);
    if (limits == null) {
      throw new IllegalArgumentException("unsupported plan: " + plan);
    }
    return limits;
  }

  public static int monthlyLimit(CustomerPlan plan) {
    return limits(plan).monthlyLimit();
  }

  public static int rateLimit(CustomerPlan plan) {
    return limits(plan).rateLimit();
  }

  public static OptionalInt logRetentionDays(CustomerPlan plan) {
    return limits(plan).logRetentionDays();
  }

  public static boolean usesOwnCredential(CustomerPlan plan) {
    return limits(plan).usesOwnCredential();
  }
}
