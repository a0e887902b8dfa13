/*
 * どこで: Quota サービス層
 * 何を: 顧客の登録、プラン変更、管理者による使用量/上限の上書き、送信認証情報の保存を担う
 * なぜ: プランと上限の整合と監査記録を同じトランザクションで保つため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.api.InvalidQuotaRequestException;
import com.notifyhub.quota.api.ResourceNotFoundException;
import com.notifyhub.quota.config.BillingCycleProperties;
import com.notifyhub.quota.model.AuditAction;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.SubscriptionStatus;
import com.notifyhub.quota.plan.PlanCatalog;
import com.notifyhub.quota.repository.CustomerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CustomerService {

  private static final Logger logger = LoggerFactory.getLogger(CustomerService.class);

  private final CustomerRepository customerRepository;
  private final CredentialVault credentialVault;
  private final CustomerAuditor auditor;
  private final BillingCycleProperties billingCycleProperties;
  private final Clock clock;

  /** サインアップ時の登録。既に存在する場合は既存行をそのまま返す。 */
  @Transactional
  public CustomerRecord register(String customerId) {
    requireId(customerId);
    final Instant now = Instant.now(clock);
    final boolean created =
        customerRepository.insert(
            customerId,
            CustomerPlan.FREE,
            PlanCatalog.monthlyLimit(CustomerPlan.FREE),
            now,
            now.plus(billingCycleProperties.cycleLength()),
            now);
    if (created) {
      auditor.record(
          customerId, AuditAction.CREATED, null, Map.of("plan", CustomerPlan.FREE.name()), now);
      logger.info("customer registered customerId={}", customerId);
    }
    return findCustomer(customerId);
  }

  public CustomerRecord get(String customerId) {
    return findCustomer(customerId);
  }

  @Transactional
  public CustomerRecord changePlan(String customerId, CustomerPlan plan) {
    if (plan == null) {
      throw new InvalidQuotaRequestException("plan is required");
    }
    final CustomerRecord customer = lockCustomer(customerId);
    final Instant now = Instant.now(clock);
    final boolean changed = customer.plan() != plan;
    final CustomerPlan previousPlan = changed ? customer.plan() : customer.previousPlan();
    final int monthlyLimit = PlanCatalog.monthlyLimit(plan);
    customerRepository.updatePlan(customerId, plan, previousPlan, monthlyLimit, now);
    final Map<String, Object> detail = new HashMap<>();
    detail.put("from", customer.plan().name());
    detail.put("to", plan.name());
    detail.put("monthly_limit", monthlyLimit);
    detail.put("catalog_version", PlanCatalog.VERSION);
    auditor.record(customerId, AuditAction.PLAN_CHANGED, "admin", detail, now);
    logger.info(
        "customer plan changed customerId={} from={} to={}", customerId, customer.plan(), plan);
    return findCustomer(customerId);
  }

  /** 使用量を指定値に置き換え、次回リセットを現在時刻から 1 サイクル後にする。 */
  @Transactional
  public CustomerRecord overrideUsage(String customerId, int usageCount) {
    if (usageCount < 0) {
      throw new InvalidQuotaRequestException("usage_count must be greater than or equal to 0");
    }
    final CustomerRecord customer = lockCustomer(customerId);
    final Instant now = Instant.now(clock);
    final Instant nextResetAt = now.plus(billingCycleProperties.cycleLength());
    customerRepository.overrideUsage(customerId, usageCount, nextResetAt, now);
    final Map<String, Object> detail = new HashMap<>();
    detail.put("previous_usage", customer.usageCount());
    detail.put("usage", usageCount);
    detail.put("reset_at", nextResetAt.toString());
    auditor.record(customerId, AuditAction.USAGE_OVERRIDDEN, "admin", detail, now);
    logger.info("customer usage overridden customerId={} usage={}", customerId, usageCount);
    return findCustomer(customerId);
  }

  @Transactional
  public CustomerRecord overrideMonthlyLimit(String customerId, int monthlyLimit) {
    if (monthlyLimit <= 0) {
      throw new InvalidQuotaRequestException("monthly_limit must be greater than 0");
    }
    final CustomerRecord customer = lockCustomer(customerId);
    final Instant now = Instant.now(clock);
    customerRepository.overrideMonthlyLimit(customerId, monthlyLimit, now);
    final Map<String, Object> detail = new HashMap<>();
    detail.put("previous_limit", customer.monthlyLimit());
    detail.put("monthly_limit", monthlyLimit);
    detail.put("catalog_limit", PlanCatalog.monthlyLimit(customer.plan()));
    auditor.record(customerId, AuditAction.LIMIT_OVERRIDDEN, "admin", detail, now);
    logger.info(
        "customer monthly limit overridden customerId={} limit={}", customerId, monthlyLimit);
    return findCustomer(customerId);
  }

  /** 決済側で確定したサブスクリプション状態を反映する。猶予判定は次回のロールオーバーで行う。 */
  @Transactional
  public CustomerRecord updateSubscription(
      String customerId, SubscriptionStatus status, Instant subscriptionEndDate) {
    if (status == null) {
      throw new InvalidQuotaRequestException("subscription_status is required");
    }
    final CustomerRecord customer = lockCustomer(customerId);
    final Instant now = Instant.now(clock);
    customerRepository.updateSubscription(customerId, status, subscriptionEndDate, now);
    final Map<String, Object> detail = new HashMap<>();
    detail.put(
        "previous_status",
        customer.subscriptionStatus() == null ? null : customer.subscriptionStatus().name());
    detail.put("status", status.name());
    detail.put(
        "subscription_end_date",
        subscriptionEndDate == null ? null : subscriptionEndDate.toString());
    auditor.record(customerId, AuditAction.SUBSCRIPTION_UPDATED, "admin", detail, now);
    logger.info(
        "customer subscription updated customerId={} status={} endDate={}",
        customerId,
        status,
        subscriptionEndDate);
    return findCustomer(customerId);
  }

  @Transactional
  public void storeSendCredential(String customerId, String plaintextCredential) {
    if (plaintextCredential == null || plaintextCredential.isBlank()) {
      throw new InvalidQuotaRequestException("api_key is required");
    }
    lockCustomer(customerId);
    final Instant now = Instant.now(clock);
    customerRepository.updateSendCredential(
        customerId, credentialVault.encrypt(plaintextCredential.trim()), now);
    auditor.record(customerId, AuditAction.CREDENTIAL_STORED, null, Map.of(), now);
    logger.info("send credential stored customerId={}", customerId);
  }

  @Transactional
  public void clearSendCredential(String customerId) {
    lockCustomer(customerId);
    final Instant now = Instant.now(clock);
    customerRepository.updateSendCredential(customerId, null, now);
    auditor.record(customerId, AuditAction.CREDENTIAL_CLEARED, null, Map.of(), now);
    logger.info("send credential cleared customerId={}", customerId);
  }

  private CustomerRecord lockCustomer(String customerId) {
    return customerRepository
        .findByIdForUpdate(customerId)
        .orElseThrow(() -> ResourceNotFoundException.customer(customerId));
  }

  private CustomerRecord findCustomer(String customerId) {
    return customerRepository
        .findById(customerId)
        .orElseThrow(() -> ResourceNotFoundException.customer(customerId));
  }

  private void requireId(String customerId) {
    if (customerId == null || customerId.isBlank()) {
      throw new InvalidQuotaRequestException("customer_id is required");
    }
  }
}
