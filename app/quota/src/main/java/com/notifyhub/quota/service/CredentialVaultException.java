/*
 * どこで: Quota サービス層
 * 何を: 保存済み認証情報トークンの形式不正や復号失敗を表す
 * なぜ: 入力起因の BAD_REQUEST と区別し、サーバ側データ不整合として扱うため
 */
package com.notifyhub.quota.service;

public class CredentialVaultException extends RuntimeException {

  public CredentialVaultException(String message) {
    super(message);
  }

  public CredentialVaultException(String message, Throwable cause) {
    super(message, cause);
  }
}
