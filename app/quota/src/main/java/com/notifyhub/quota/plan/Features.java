/*
 * どこで: Quota プラン定義
 * 何を: 機能マトリクスで使う機能名を定義する
 * なぜ: 呼び出し側と設定で同じ文字列を使うため
 */
package com.notifyhub.quota.plan;

public final class Features {

  public static final String CUSTOM_DOMAIN = "custom_domain";
  public static final String PRIORITY_QUEUE = "priority_queue";
  public static final String WEBHOOK = "webhook";
  public static final String EMAIL = "email";

  private Features() {}
}
