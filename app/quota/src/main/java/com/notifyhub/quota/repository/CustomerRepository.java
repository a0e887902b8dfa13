/*
 * どこで: Quota データアクセス
 * 何を: customers の登録/更新/参照を行う
 * なぜ: 使用量の原子的加算やドメイン一意性を DB 側の操作として一箇所に集めるため
 */
package com.notifyhub.quota.repository;

import static com.notifyhub.common.JdbcTimestampUtils.getInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.DnsRecord;
import com.notifyhub.quota.model.SubscriptionStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustomerRepository {

  private static final TypeReference<List<DnsRecord>> DNS_RECORDS_TYPE = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT id, plan, previous_plan, monthly_limit, usage_count, usage_reset_at,
             billing_cycle_start_at, is_active, subscription_status, subscription_end_date,
             downgraded_at, sendgrid_api_key, sending_domain, domain_verified,
             domain_provider_id, domain_dns_records::text AS domain_dns_records,
             domain_requested_at, domain_verified_at, domain_checked_at
      FROM customers
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public boolean insert(
      String id,
      CustomerPlan plan,
      int monthlyLimit,
      Instant billingCycleStartAt,
      Instant usageResetAt,
      Instant now) {
    // 同じ ID の再登録は既存行を変更しない
    final String sql =
        """
        INSERT INTO customers (
          id, plan, monthly_limit, usage_count, usage_reset_at, billing_cycle_start_at,
          is_active, domain_verified, created_at, updated_at
        ) VALUES (
          :id, :plan, :monthlyLimit, 0, :usageResetAt, :billingCycleStartAt,
          TRUE, FALSE, :now, :now
        )
        ON CONFLICT (id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("plan", plan.name())
            .addValue("monthlyLimit", monthlyLimit)
            .addValue("usageResetAt", toTimestamp(usageResetAt))
            .addValue("billingCycleStartAt", toTimestamp(billingCycleStartAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public Optional<CustomerRecord> findById(String id) {
    final String sql = SELECT_COLUMNS + " WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<CustomerRecord> findByIdForUpdate(String id) {
    final String sql = SELECT_COLUMNS + " WHERE id = :id FOR UPDATE";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<String> findIdsDueForRollover(Instant now, int limit) {
    final String sql =
        """
        SELECT id
        FROM customers
        WHERE usage_reset_at <= :now
          AND is_active
        ORDER BY usage_reset_at
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("limit", limit);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public int incrementUsage(String id, Instant now) {
    // 読み取りを挟まず 1 文で加算し、同時実行でも取りこぼさない
    final String sql =
        """
        UPDATE customers
        SET usage_count = usage_count + 1,
            updated_at = :now
        WHERE id = :id
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource().addValue("id", id).addValue("now", toTimestamp(now)));
  }

  public int incrementUsageWithinLimit(String id, Instant now) {
    // 上限判定と加算を同じ行更新で行い、同時送信でも上限を超えない
    final String sql =
        """
        UPDATE customers
        SET usage_count = usage_count + 1,
            updated_at = :now
        WHERE id = :id
          AND usage_count < monthly_limit
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource().addValue("id", id).addValue("now", toTimestamp(now)));
  }

  public int resetUsage(String id, Instant billingCycleStartAt, Instant usageResetAt) {
    final String sql =
        """
        UPDATE customers
        SET usage_count = 0,
            usage_reset_at = :usageResetAt,
            billing_cycle_start_at = :billingCycleStartAt,
            updated_at = :billingCycleStartAt
        WHERE id = :id
        """;
    return jdbcTemplate.update(sql, cycleParams(id, billingCycleStartAt, usageResetAt));
  }

  public int resetUsageIfDue(String id, Instant now, Instant usageResetAt) {
    // 期限前なら更新しないため、同じサイクル内の再実行は 0 件になる
    final String sql =
        """
        UPDATE customers
        SET usage_count = 0,
            usage_reset_at = :usageResetAt,
            billing_cycle_start_at = :billingCycleStartAt,
            updated_at = :billingCycleStartAt
        WHERE id = :id
          AND usage_reset_at <= :billingCycleStartAt
        """;
    return jdbcTemplate.update(sql, cycleParams(id, now, usageResetAt));
  }

  public int downgradeToFree(
      String id,
      CustomerPlan previousPlan,
      int freeMonthlyLimit,
      Instant now,
      Instant usageResetAt) {
    final String sql =
        """
        UPDATE customers
        SET plan = 'FREE',
            previous_plan = :previousPlan,
            monthly_limit = :monthlyLimit,
            usage_count = 0,
            usage_reset_at = :usageResetAt,
            billing_cycle_start_at = :billingCycleStartAt,
            downgraded_at = :billingCycleStartAt,
            subscription_status = 'EXPIRED',
            updated_at = :billingCycleStartAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        cycleParams(id, now, usageResetAt)
            .addValue("previousPlan", previousPlan == null ? null : previousPlan.name())
            .addValue("monthlyLimit", freeMonthlyLimit);
    return jdbcTemplate.update(sql, params);
  }

  public int updatePlan(
      String id, CustomerPlan plan, CustomerPlan previousPlan, int monthlyLimit, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET plan = :plan,
            previous_plan = :previousPlan,
            monthly_limit = :monthlyLimit,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("plan", plan.name())
            .addValue("previousPlan", previousPlan == null ? null : previousPlan.name())
            .addValue("monthlyLimit", monthlyLimit)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateSubscription(
      String id, SubscriptionStatus status, Instant subscriptionEndDate, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET subscription_status = :status,
            subscription_end_date = :subscriptionEndDate,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", status == null ? null : status.name())
            .addValue("subscriptionEndDate", toTimestamp(subscriptionEndDate))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int overrideUsage(String id, int usageCount, Instant usageResetAt, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET usage_count = :usageCount,
            usage_reset_at = :usageResetAt,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("usageCount", usageCount)
            .addValue("usageResetAt", toTimestamp(usageResetAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int overrideMonthlyLimit(String id, int monthlyLimit, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET monthly_limit = :monthlyLimit,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("monthlyLimit", monthlyLimit)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateSendCredential(String id, String encryptedCredential, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET sendgrid_api_key = :credential,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("credential", encryptedCredential)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public boolean existsVerifiedDomainForOtherCustomer(String domain, String customerId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM customers
          WHERE sending_domain = :domain
            AND domain_verified
            AND id <> :customerId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("customerId", customerId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int saveDomainRequest(
      String id,
      String domain,
      String providerId,
      List<DnsRecord> dnsRecords,
      boolean verified,
      Instant requestedAt) {
    final String sql =
        """
        UPDATE customers
        SET sending_domain = :domain,
            domain_provider_id = :providerId,
            domain_dns_records = CAST(:dnsRecords AS jsonb),
            domain_verified = :verified,
            domain_requested_at = :requestedAt,
            domain_verified_at = :verifiedAt,
            domain_checked_at = NULL,
            updated_at = :requestedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("domain", domain)
            .addValue("providerId", providerId)
            .addValue("dnsRecords", writeDnsRecords(dnsRecords))
            .addValue("verified", verified)
            .addValue("requestedAt", toTimestamp(requestedAt))
            .addValue("verifiedAt", verified ? toTimestamp(requestedAt) : null);
    return jdbcTemplate.update(sql, params);
  }

  public int markDomainChecked(String id, boolean verified, Instant checkedAt) {
    // 既に検証済みなら verified_at は最初の確認時刻のまま残す
    final String sql =
        """
        UPDATE customers
        SET domain_verified = domain_verified OR :verified,
            domain_verified_at = CASE
              WHEN :verified AND NOT domain_verified THEN :checkedAt
              ELSE domain_verified_at
            END,
            domain_checked_at = :checkedAt,
            updated_at = :checkedAt
        WHERE id = :id
          AND domain_provider_id IS NOT NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("verified", verified)
            .addValue("checkedAt", toTimestamp(checkedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int clearDomain(String id, Instant now) {
    final String sql =
        """
        UPDATE customers
        SET sending_domain = NULL,
            domain_verified = FALSE,
            domain_provider_id = NULL,
            domain_dns_records = NULL,
            domain_requested_at = NULL,
            domain_verified_at = NULL,
            domain_checked_at = NULL,
            updated_at = :now
        WHERE id = :id
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource().addValue("id", id).addValue("now", toTimestamp(now)));
  }

  private MapSqlParameterSource cycleParams(
      String id, Instant billingCycleStartAt, Instant usageResetAt) {
    return new MapSqlParameterSource()
        .addValue("id", id)
        .addValue("billingCycleStartAt", toTimestamp(billingCycleStartAt))
        .addValue("usageResetAt", toTimestamp(usageResetAt));
  }

  private String writeDnsRecords(List<DnsRecord> dnsRecords) {
    if (dnsRecords == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(dnsRecords);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize dns records", ex);
    }
  }

  private List<DnsRecord> readDnsRecords(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, DNS_RECORDS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse dns records", ex);
    }
  }

  private CustomerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String previousPlan = rs.getString("previous_plan");
    final String subscriptionStatus = rs.getString("subscription_status");
    return new CustomerRecord(
        rs.getString("id"),
        CustomerPlan.valueOf(rs.getString("plan")),
        previousPlan == null ? null : CustomerPlan.valueOf(previousPlan),
        rs.getInt("monthly_limit"),
        rs.getInt("usage_count"),
        getInstant(rs, "usage_reset_at"),
        getInstant(rs, "billing_cycle_start_at"),
        rs.getBoolean("is_active"),
        subscriptionStatus == null ? null : SubscriptionStatus.valueOf(subscriptionStatus),
        getInstant(rs, "subscription_end_date"),
        getInstant(rs, "downgraded_at"),
        rs.getString("sendgrid_api_key"),
        rs.getString("sending_domain"),
        rs.getBoolean("domain_verified"),
        rs.getString("domain_provider_id"),
        readDnsRecords(rs.getString("domain_dns_records")),
        getInstant(rs, "domain_requested_at"),
        getInstant(rs, "domain_verified_at"),
        getInstant(rs, "domain_checked_at"));
  }
}
