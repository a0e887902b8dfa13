/*
 * どこで: Quota アプリの設定バインド
 * 何を: 認証情報暗号化の鍵(64 桁 hex)を保持する
 * なぜ: 鍵をコードに埋め込まず環境変数から注入するため
 */
package com.notifyhub.quota.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "quota.credential-vault")
public record CredentialVaultProperties(String encryptionKey) {

  @Override
  public String toString() {
    return "CredentialVaultProperties[encryptionKey=***]";
  }
}
