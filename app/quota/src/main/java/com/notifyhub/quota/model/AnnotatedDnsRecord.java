/*
 * どこで: Quota ドメインモデル
 * 何を: 表示用の番号と説明を付けた DNS レコードを表す
 * なぜ: テナントがレジストラで設定すべき内容を判別できるようにするため
 */
package com.notifyhub.quota.model;

import java.util.ArrayList;
import java.util.List;

public record AnnotatedDnsRecord(
    int id, String type, String host, String value, String description) {

  private static final List<String> DESCRIPTIONS =
      List.of(
          "Mail CNAME - Routes email through SendGrid",
          "DKIM 1 - Email authentication (prevents spoofing)",
          "DKIM 2 - Email authentication (backup)");
  private static final String FALLBACK_DESCRIPTION = "DNS Record";

  public static List<AnnotatedDnsRecord> annotate(List<DnsRecord> records) {
    if (records == null) {
      return List.of();
    }
    final List<AnnotatedDnsRecord> annotated = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      final DnsRecord record = records.get(i);
      annotated.add(
          new AnnotatedDnsRecord(
              i + 1, record.type(), record.host(), record.value(), describe(i)));
    }
    return List.copyOf(annotated);
  }

  static String describe(int position) {
    return position < DESCRIPTIONS.size() ? DESCRIPTIONS.get(position) : FALLBACK_DESCRIPTION;
  }
}
