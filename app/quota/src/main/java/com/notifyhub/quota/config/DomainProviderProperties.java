/*
 * どこで: Quota アプリの設定バインド
 * 何を: ドメイン認証プロバイダ(SendGrid)の接続先、API キー、タイムアウトを保持する
 * なぜ: 外部呼び出しの上限時間とパスを運用で調整できるようにするため
 */
package com.notifyhub.quota.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "quota.domain-provider")
public record DomainProviderProperties(
    String baseUrl,
    String apiKey,
    String subdomain,
    String authenticatePath,
    String validatePath,
    String deletePath,
    Duration connectTimeout,
    Duration readTimeout) {

  public DomainProviderProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.sendgrid.com/v3" : baseUrl;
    apiKey = apiKey == null ? "" : apiKey;
    subdomain = subdomain == null || subdomain.isBlank() ? "em" : subdomain;
    authenticatePath =
        authenticatePath == null || authenticatePath.isBlank()
            ? "/whitelabel/domains"
            : authenticatePath;
    validatePath =
        validatePath == null || validatePath.isBlank()
            ? "/whitelabel/domains/{domainId}/validate"
            : validatePath;
    deletePath =
        deletePath == null || deletePath.isBlank() ? "/whitelabel/domains/{domainId}" : deletePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }

  @Override
  public String toString() {
    return "DomainProviderProperties[baseUrl="
        + baseUrl
        + ", subdomain="
        + subdomain
        + ", connectTimeout="
        + connectTimeout
        + ", readTimeout="
        + readTimeout
        + "]";
  }
}
