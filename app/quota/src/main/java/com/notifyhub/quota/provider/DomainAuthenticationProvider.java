/*
 * どこで: Quota 外部連携
 * 何を: ドメイン認証プロバイダの契約(登録/検証/削除)を定義する
 * なぜ: ワークフローを特定プロバイダの HTTP 仕様から切り離すため
 */
package com.notifyhub.quota.provider;

/**
 * 送信ドメインを外部プロバイダで認証するための契約。
 *
 * <p>どの操作も同期のブロッキング I/O で、失敗は {@link DomainProviderException} として返す。
 */
public interface DomainAuthenticationProvider {

  DomainAuthentication authenticate(String domain);

  DomainValidation validate(String referenceId);

  void delete(String referenceId);
}
