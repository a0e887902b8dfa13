/*
 * どこで: Quota サービス層
 * 何を: 送信ドメインのホスト名書式を検証し正規化する
 * なぜ: 不正な入力を外部プロバイダ呼び出しの前に弾くため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.api.InvalidQuotaRequestException;
import java.util.Locale;
import java.util.regex.Pattern;

public final class DomainNameValidator {

  static final String MESSAGE_INVALID = "Invalid domain format";

  private static final int MAX_LENGTH = 253;
  private static final Pattern HOSTNAME =
      Pattern.compile(
          "^(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z0-9][a-z0-9-]{0,61}[a-z0-9]$");

  private DomainNameValidator() {}

  public static boolean isValid(String domain) {
    if (domain == null) {
      return false;
    }
    final String normalized = domain.trim().toLowerCase(Locale.ROOT);
    return normalized.length() <= MAX_LENGTH && HOSTNAME.matcher(normalized).matches();
  }

  /** 前後空白を除いて小文字化した値を返す。書式不正なら例外。 */
  public static String normalize(String domain) {
    if (!isValid(domain)) {
      throw new InvalidQuotaRequestException(MESSAGE_INVALID);
    }
    return domain.trim().toLowerCase(Locale.ROOT);
  }
}
