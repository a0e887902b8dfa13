/*
 * どこで: Quota 外部連携
 * 何を: ドメイン認証プロバイダ呼び出しの失敗を表現する
 * なぜ: 呼び出し側がリトライか中断かを理由別に判断できるようにするため
 */
package com.notifyhub.quota.provider;

public class DomainProviderException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    BAD_GATEWAY,
    REJECTED,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final String providerMessage;

  public DomainProviderException(Reason reason, String message, String providerMessage) {
    super(message);
    this.reason = reason;
    this.providerMessage = providerMessage;
  }

  public DomainProviderException(
      Reason reason, String message, String providerMessage, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.providerMessage = providerMessage;
  }

  public Reason reason() {
    return reason;
  }

  public String providerMessage() {
    return providerMessage;
  }

  public boolean retryable() {
    return reason == Reason.TIMEOUT || reason == Reason.BAD_GATEWAY;
  }
}
