/*
 * どこで: Quota API
 * 何を: 説明付き DNS レコードのレスポンスを表す
 * なぜ: 登録応答と状態参照で同じ形式を返すため
 */
package com.notifyhub.quota.api;

import com.notifyhub.quota.model.AnnotatedDnsRecord;
import java.util.List;

public record DnsRecordResponse(
    int id, String type, String host, String value, String description) {

  public static List<DnsRecordResponse> fromAll(List<AnnotatedDnsRecord> records) {
    return records.stream()
        .map(
            record ->
                new DnsRecordResponse(
                    record.id(),
                    record.type(),
                    record.host(),
                    record.value(),
                    record.description()))
        .toList();
  }
}
