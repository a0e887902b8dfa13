/*
 * どこで: Quota サービス層
 * 何を: 送信前の機能ゲート判定、上限判定、使用量加算をまとめて行う
 * なぜ: ジョブ投入経路が「今このテナントは送れるか」を一度の呼び出しで得られるようにするため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.api.PlanRestrictedException;
import com.notifyhub.quota.api.QuotaExceededException;
import com.notifyhub.quota.api.ResourceNotFoundException;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.RolloverOutcome;
import com.notifyhub.quota.model.SendAuthorization;
import com.notifyhub.quota.model.SendRequest;
import com.notifyhub.quota.model.UsageStats;
import com.notifyhub.quota.plan.FeatureGate;
import com.notifyhub.quota.plan.GateContext;
import com.notifyhub.quota.plan.PlanCatalog;
import com.notifyhub.quota.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SendAuthorizationService {

  private static final Logger logger = LoggerFactory.getLogger(SendAuthorizationService.class);

  static final String FEATURE_ACCOUNT = "account";
  static final String MESSAGE_INACTIVE = "Your account is inactive. Please contact support.";

  private final CustomerRepository customerRepository;
  private final BillingCycleService billingCycleService;
  private final UsageTracker usageTracker;
  private final FeatureGate featureGate;
  private final CredentialVault credentialVault;
  private final QuotaMetrics metrics;

  public SendAuthorization authorize(String customerId, SendRequest request) {
    final SendRequest sendRequest = request == null ? SendRequest.email() : request;
    CustomerRecord customer = findCustomer(customerId);
    try {
      if (!customer.active()) {
        throw new PlanRestrictedException(FEATURE_ACCOUNT, MESSAGE_INACTIVE);
      }
      if (billingCycleService.rollOverIfDue(customer) != RolloverOutcome.NOT_DUE) {
        customer = findCustomer(customerId);
      }

      final String credential =
          customer.hasSendCredential() ? credentialVault.decrypt(customer.sendgridApiKey()) : null;
      final GateContext context = GateContext.of(customer, credential);
      featureGate.assertFeatureAllowed(context, sendRequest.feature());
      if (sendRequest.isEmail()) {
        featureGate.assertCanSendEmail(context);
        if (customer.plan().isPaid()) {
          featureGate.assertCanUseCustomDomain(context);
        }
      }
      if (sendRequest.priority()) {
        featureGate.assertCanUsePriorityQueue(context);
      }

      final UsageStats stats = usageTracker.statsOf(customer);
      if (stats.usage() >= stats.limit()) {
        throw quotaExceeded(customerId, stats);
      }
      if (!usageTracker.tryConsume(customerId)) {
        // 読み取り後に別リクエストが残り枠を使い切った
        throw quotaExceeded(customerId, usageTracker.getUsageStats(customerId));
      }
      metrics.recordSendAuthorization("allowed");
      logger.debug(
          "send authorized customerId={} usage={} limit={}",
          customerId,
          stats.usage() + 1,
          stats.limit());

      // 共有認証情報で送るプランでは保存済みキーがあっても使わない
      final String sendCredential =
          PlanCatalog.usesOwnCredential(customer.plan()) ? credential : null;
      return new SendAuthorization(
          customerId,
          customer.plan(),
          sendCredential,
          customer.domainVerified() ? customer.sendingDomain() : null,
          sendRequest.priority(),
          Math.max(0, stats.remaining() - 1));
    } catch (PlanRestrictedException ex) {
      metrics.recordSendAuthorization("plan_restricted");
      logger.info(
          "send denied by feature gate customerId={} feature={} reason={}",
          customerId,
          ex.feature(),
          ex.getMessage());
      throw ex;
    } catch (QuotaExceededException ex) {
      metrics.recordSendAuthorization("quota_exceeded");
      throw ex;
    }
  }

  private QuotaExceededException quotaExceeded(String customerId, UsageStats stats) {
    logger.warn(
        "usage limit exceeded customerId={} usage={} limit={}",
        customerId,
        stats.usage(),
        stats.limit());
    return new QuotaExceededException(stats.usage(), stats.limit(), stats.resetAt());
  }

  private CustomerRecord findCustomer(String customerId) {
    return customerRepository
        .findById(customerId)
        .orElseThrow(() -> ResourceNotFoundException.customer(customerId));
  }
}
