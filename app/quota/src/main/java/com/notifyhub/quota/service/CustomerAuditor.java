/*
 * どこで: Quota サービス層
 * 何を: 顧客の変更操作を customer_audit へ記録する
 * なぜ: 監査レコードの組み立てと JSON 化を各サービスで重複させないため
 */
package com.notifyhub.quota.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.quota.model.AuditAction;
import com.notifyhub.quota.model.CustomerAuditRecord;
import com.notifyhub.quota.repository.CustomerAuditRepository;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CustomerAuditor {

  private final CustomerAuditRepository auditRepository;
  private final ObjectMapper objectMapper;

  public void record(
      String customerId,
      AuditAction action,
      String reason,
      Map<String, ?> detail,
      Instant occurredAt) {
    auditRepository.insert(
        new CustomerAuditRecord(
            UUID.randomUUID(), occurredAt, customerId, action, reason, toJson(detail)));
  }

  private String toJson(Map<String, ?> detail) {
    try {
      return objectMapper.writeValueAsString(detail == null ? Map.of() : detail);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize audit detail", ex);
    }
  }
}
