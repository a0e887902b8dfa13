/*
 * どこで: Quota 外部連携
 * 何を: DNS 検証結果とレコード単位の詳細を表す
 * なぜ: どのレコードが誤っているかをテナントへ示すため
 */
package com.notifyhub.quota.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DomainValidation(boolean valid, Map<String, RecordValidation> perRecordResults) {

  public DomainValidation {
    // 表示順を保つため LinkedHashMap で保持する。
    perRecordResults =
        perRecordResults == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(perRecordResults));
  }

  public record RecordValidation(boolean valid, String reason) {}
}
