/*
 * どこで: Quota データアクセス
 * 何を: customer_audit の登録を行う
 * なぜ: プランや上限の変更理由を後から追えるようにするため
 */
package com.notifyhub.quota.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.quota.model.CustomerAuditRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustomerAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(CustomerAuditRecord record) {
    final String sql =
        """
        INSERT INTO customer_audit (
          audit_id,
          occurred_at,
          customer_id,
          action,
          reason,
          detail_json
        ) VALUES (
          :auditId,
          :occurredAt,
          :customerId,
          :action,
          :reason,
          CAST(:detail AS jsonb)
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("customerId", record.customerId())
            .addValue("action", record.action().name())
            .addValue("reason", record.reason())
            .addValue("detail", record.detailJson());
    return jdbcTemplate.update(sql, params);
  }
}
