/*
 * どこで: Quota ドメインモデル
 * 何を: 送信ドメイン検証の状態と許可される遷移を定義する
 * なぜ: フィールドの組み合わせから状態を推測せず、遷移表として検証できるようにするため
 */
package com.notifyhub.quota.model;

import java.util.EnumSet;
import java.util.Set;

public enum DomainState {
  /** ドメイン未登録。 */
  NONE,
  /** プロバイダ登録済みで、まだ検証を確認していない。 */
  REQUESTED,
  /** 検証を確認したが DNS が未反映。 */
  PENDING,
  /** 検証済み。 */
  VERIFIED;

  public static DomainState of(CustomerRecord customer) {
    if (customer.sendingDomain() == null) {
      return NONE;
    }
    if (customer.domainVerified()) {
      return VERIFIED;
    }
    return customer.domainCheckedAt() == null ? REQUESTED : PENDING;
  }

  public Set<DomainState> allowedTransitions() {
    return switch (this) {
      case NONE -> EnumSet.of(REQUESTED, VERIFIED);
      case REQUESTED -> EnumSet.of(REQUESTED, PENDING, VERIFIED, NONE);
      case PENDING -> EnumSet.of(REQUESTED, PENDING, VERIFIED, NONE);
      case VERIFIED -> EnumSet.of(REQUESTED, VERIFIED, NONE);
    };
  }

  public boolean canTransitionTo(DomainState next) {
    return allowedTransitions().contains(next);
  }

  public String label() {
    return switch (this) {
      case NONE -> "none";
      case REQUESTED, PENDING -> "pending";
      case VERIFIED -> "verified";
    };
  }
}
