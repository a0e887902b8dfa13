/*
 * どこで: Quota ドメインモデル
 * 何を: customer_audit の登録用データを表す
 * なぜ: 監査ログの構築を呼び出し側から隠蔽するため
 */
package com.notifyhub.quota.model;

import java.time.Instant;
import java.util.UUID;

public record CustomerAuditRecord(
    UUID auditId,
    Instant occurredAt,
    String customerId,
    AuditAction action,
    String reason,
    String detailJson) {}
