/*
 * どこで: Quota 設定
 * 何を: 機能マトリクスを起動時に一度だけ構築して Bean として公開する
 * なぜ: FeatureGate が可変なグローバル表を参照しないようにするため
 */
package com.notifyhub.quota.config;

import com.notifyhub.quota.plan.FeatureMatrix;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FeatureMatrixConfig {

  @Bean
  FeatureMatrix featureMatrix() {
    return FeatureMatrix.defaults();
  }
}
