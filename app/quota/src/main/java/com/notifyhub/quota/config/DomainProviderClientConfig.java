/*
 * どこで: Quota 設定
 * 何を: ドメイン認証プロバイダ呼び出し専用の RestClient を提供する
 * なぜ: 接続/読み取りタイムアウトと認証ヘッダを呼び出し箇所から分離するため
 */
package com.notifyhub.quota.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(DomainProviderProperties.class)
public class DomainProviderClientConfig {

  @Bean
  RestClient domainProviderRestClient(
      RestClient.Builder builder, DomainProviderProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
        .build();
  }
}
