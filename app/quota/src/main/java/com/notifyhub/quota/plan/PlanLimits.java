/*
 * どこで: Quota プラン定義
 * 何を: プラン 1 件分の上限値と料金、独自認証情報の要否を保持する
 * なぜ: 上限 0 のような設定不備をカタログ構築時に検出するため
 */
package com.notifyhub.quota.plan;

import com.notifyhub.quota.api.QuotaConfigurationException;
import java.math.BigDecimal;
import java.util.List;
import java.util.OptionalInt;

public record PlanLimits(
    String name,
    int monthlyLimit,
    int rateLimit,
    OptionalInt logRetentionDays,
    BigDecimal price,
    boolean usesOwnCredential,
    List<String> features) {

  public PlanLimits {
    if (monthlyLimit <= 0) {
      throw new QuotaConfigurationException(
          "monthlyLimit must be positive for plan " + name + ": " + monthlyLimit);
    }
    if (rateLimit <= 0) {
      throw new QuotaConfigurationException(
          "rateLimit must be positive for plan " + name + ": " + rateLimit);
    }
    features = List.copyOf(features);
  }

  public boolean hasUnlimitedLogRetention() {
    return logRetentionDays.isEmpty();
  }
}
