/*
 * どこで: Quota プラン定義
 * 何を: 機能名 -> 利用可能プランの不変な対応表を保持する
 * なぜ: 起動時に一度だけ構築し、FeatureGate へ明示的に注入するため
 */
package com.notifyhub.quota.plan;

import com.notifyhub.quota.model.CustomerPlan;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public final class FeatureMatrix {

  private final Map<String, Set<CustomerPlan>> allowedPlans;

  public FeatureMatrix(Map<String, Set<CustomerPlan>> allowedPlans) {
    final Map<String, Set<CustomerPlan>> copy = new HashMap<>();
    allowedPlans.forEach(
        (feature, plans) -> {
          if (feature == null || feature.isBlank()) {
            throw new IllegalArgumentException("feature name is required");
          }
          copy.put(feature, Set.copyOf(plans));
        });
    this.allowedPlans = Map.copyOf(copy);
  }

  public static FeatureMatrix defaults() {
    return new FeatureMatrix(
        Map.of(
            Features.CUSTOM_DOMAIN, EnumSet.of(CustomerPlan.INDIE, CustomerPlan.STARTUP),
            Features.PRIORITY_QUEUE, EnumSet.of(CustomerPlan.INDIE, CustomerPlan.STARTUP),
            Features.WEBHOOK, EnumSet.allOf(CustomerPlan.class),
            Features.EMAIL, EnumSet.allOf(CustomerPlan.class)));
  }

  // 未知の機能名は空集合として扱い、例外にはしない。
  public Set<CustomerPlan> allowedPlans(String feature) {
    if (feature == null) {
      return Set.of();
    }
    return allowedPlans.getOrDefault(feature, Set.of());
  }

  public boolean isAllowed(String feature, CustomerPlan plan) {
    return plan != null && allowedPlans(feature).contains(plan);
  }

  public Set<String> features() {
    return allowedPlans.keySet();
  }
}
