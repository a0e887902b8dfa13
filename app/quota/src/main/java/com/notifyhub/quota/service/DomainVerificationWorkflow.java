/*
 * どこで: Quota サービス層
 * 何を: 送信ドメインの登録/検証確認/参照/削除を外部プロバイダと連携して行う
 * なぜ: DNS 反映待ちを前提に、要求と確認を分けた状態遷移を一箇所で管理するため
 */
package com.notifyhub.quota.service;

import com.notifyhub.quota.api.DomainConflictException;
import com.notifyhub.quota.api.InvalidQuotaRequestException;
import com.notifyhub.quota.api.ResourceNotFoundException;
import com.notifyhub.quota.model.AnnotatedDnsRecord;
import com.notifyhub.quota.model.AuditAction;
import com.notifyhub.quota.model.CleanupResult;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.DomainRequestResult;
import com.notifyhub.quota.model.DomainSetupInstructions;
import com.notifyhub.quota.model.DomainState;
import com.notifyhub.quota.model.DomainStatus;
import com.notifyhub.quota.model.DomainVerificationResult;
import com.notifyhub.quota.provider.DomainAuthentication;
import com.notifyhub.quota.provider.DomainAuthenticationProvider;
import com.notifyhub.quota.provider.DomainProviderException;
import com.notifyhub.quota.provider.DomainValidation;
import com.notifyhub.quota.repository.CustomerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 送信ドメイン検証のワークフロー。
 *
 * <p>状態は保存済みの列から {@link DomainState} として導出し、書き込み前に遷移表で検査する。
 * プロバイダ呼び出しはトランザクション外で行い、列の更新と監査記録は同じトランザクションで書く。
 * バックグラウンドのポーリングは持たない。
 */
@Service
public class DomainVerificationWorkflow {

  private static final Logger logger = LoggerFactory.getLogger(DomainVerificationWorkflow.class);

  static final String MESSAGE_FREE_PLAN =
      "Custom domain is only available for paid plans (Indie, Startup)";
  static final String MESSAGE_NO_DOMAIN = "No domain configured. Please add a domain first.";
  static final String MESSAGE_REMOVED = "Domain removed successfully";

  private static final String OPERATION_AUTHENTICATE = "authenticate";
  private static final String OPERATION_VALIDATE = "validate";
  private static final String OPERATION_DELETE = "delete";

  private final CustomerRepository customerRepository;
  private final DomainAuthenticationProvider domainProvider;
  private final CustomerAuditor auditor;
  private final QuotaMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;

  public DomainVerificationWorkflow(
      CustomerRepository customerRepository,
      DomainAuthenticationProvider domainProvider,
      CustomerAuditor auditor,
      QuotaMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.customerRepository = customerRepository;
    this.domainProvider = domainProvider;
    this.auditor = auditor;
    this.metrics = metrics;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public DomainRequestResult request(String customerId, String rawDomain) {
    final CustomerRecord customer = findCustomer(customerId);
    if (customer.plan() == CustomerPlan.FREE) {
      throw new InvalidQuotaRequestException(MESSAGE_FREE_PLAN);
    }
    final String domain = DomainNameValidator.normalize(rawDomain);
    if (customerRepository.existsVerifiedDomainForOtherCustomer(domain, customerId)) {
      logger.info(
          "domain request rejected, verified elsewhere customerId={} domain={}",
          customerId,
          domain);
      throw new DomainConflictException(domain);
    }

    // 新しい登録を保存してから古い登録を消す。登録に失敗しても既存の状態はそのまま残る
    final DomainAuthentication authentication =
        callProvider(OPERATION_AUTHENTICATE, () -> domainProvider.authenticate(domain));
    final String previousReferenceId = customer.domainProviderId();
    final boolean sameRegistration =
        Objects.equals(previousReferenceId, authentication.referenceId());

    final DomainState current = customer.domainState();
    final DomainState next = authentication.valid() ? DomainState.VERIFIED : DomainState.REQUESTED;
    final Instant now = Instant.now(clock);
    try {
      requireTransition(customerId, current, next);
      transactionTemplate.executeWithoutResult(
          status -> saveRequest(customer, domain, authentication, now));
    } catch (RuntimeException ex) {
      if (!sameRegistration) {
        cleanupRegistration(customerId, authentication.referenceId());
      }
      if (ex instanceof DuplicateKeyException) {
        throw new DomainConflictException(domain, ex);
      }
      throw ex;
    }

    final CleanupResult cleanup =
        sameRegistration
            ? CleanupResult.notNeeded()
            : cleanupRegistration(customerId, previousReferenceId);
    logger.info(
        "domain verification requested customerId={} domain={} state={} cleanupSucceeded={}",
        customerId,
        domain,
        next,
        cleanup.succeeded());

    return new DomainRequestResult(
        domain,
        next,
        AnnotatedDnsRecord.annotate(authentication.dnsRecords()),
        DomainSetupInstructions.DEFAULT,
        cleanup);
  }

  public DomainVerificationResult checkVerification(String customerId) {
    final CustomerRecord customer = findCustomer(customerId);
    if (customer.domainProviderId() == null) {
      throw new ResourceNotFoundException(MESSAGE_NO_DOMAIN);
    }
    final String referenceId = customer.domainProviderId();
    final DomainValidation validation =
        callProvider(OPERATION_VALIDATE, () -> domainProvider.validate(referenceId));

    final boolean newlyVerified = validation.valid() && !customer.domainVerified();
    final DomainState current = customer.domainState();
    final DomainState next =
        customer.domainVerified() || validation.valid()
            ? DomainState.VERIFIED
            : DomainState.PENDING;
    requireTransition(customerId, current, next);

    final Instant now = Instant.now(clock);
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            customerRepository.markDomainChecked(customerId, validation.valid(), now);
            if (newlyVerified) {
              auditor.record(
                  customerId,
                  AuditAction.DOMAIN_VERIFIED,
                  "validated",
                  Map.of("domain", customer.sendingDomain()),
                  now);
            }
          });
    } catch (DuplicateKeyException ex) {
      throw new DomainConflictException(customer.sendingDomain(), ex);
    }
    if (newlyVerified) {
      logger.info("domain verified customerId={} domain={}", customerId, customer.sendingDomain());
    }

    if (validation.valid()) {
      return new DomainVerificationResult(
          customer.sendingDomain(), true, next, DomainVerificationResult.MESSAGE_VERIFIED, null);
    }
    final Map<String, DomainVerificationResult.RecordCheck> details = new LinkedHashMap<>();
    validation
        .perRecordResults()
        .forEach(
            (name, result) ->
                details.put(
                    name,
                    new DomainVerificationResult.RecordCheck(result.valid(), result.reason())));
    return new DomainVerificationResult(
        customer.sendingDomain(),
        false,
        next,
        DomainVerificationResult.MESSAGE_NOT_VERIFIED,
        details);
  }

  public DomainStatus getStatus(String customerId) {
    return DomainStatus.of(findCustomer(customerId));
  }

  public String removeDomain(String customerId) {
    final CustomerRecord customer = findCustomer(customerId);
    final CleanupResult cleanup = cleanupRegistration(customerId, customer.domainProviderId());
    final DomainState current = customer.domainState();
    if (current != DomainState.NONE) {
      requireTransition(customerId, current, DomainState.NONE);
    }
    final Instant now = Instant.now(clock);
    transactionTemplate.executeWithoutResult(
        status -> {
          customerRepository.clearDomain(customerId, now);
          if (current != DomainState.NONE) {
            final Map<String, Object> detail = new HashMap<>();
            detail.put("domain", customer.sendingDomain());
            detail.put("cleanup_succeeded", cleanup.succeeded());
            auditor.record(customerId, AuditAction.DOMAIN_REMOVED, null, detail, now);
          }
        });
    logger.info("domain removed customerId={} domain={}", customerId, customer.sendingDomain());
    return MESSAGE_REMOVED;
  }

  private void saveRequest(
      CustomerRecord customer, String domain, DomainAuthentication authentication, Instant now) {
    final String customerId = customer.id();
    final int updated =
        customerRepository.saveDomainRequest(
            customerId,
            domain,
            authentication.referenceId(),
            authentication.dnsRecords(),
            authentication.valid(),
            now);
    if (updated == 0) {
      throw ResourceNotFoundException.customer(customerId);
    }
    final Map<String, Object> detail = new HashMap<>();
    detail.put("domain", domain);
    detail.put("reference_id", authentication.referenceId());
    detail.put("valid", authentication.valid());
    detail.put("previous_domain", customer.sendingDomain());
    detail.put("previous_reference_id", customer.domainProviderId());
    auditor.record(customerId, AuditAction.DOMAIN_REQUESTED, null, detail, now);
    if (authentication.valid()) {
      auditor.record(
          customerId, AuditAction.DOMAIN_VERIFIED, "initial", Map.of("domain", domain), now);
    }
  }

  private CleanupResult cleanupRegistration(String customerId, String referenceId) {
    if (referenceId == null) {
      return CleanupResult.notNeeded();
    }
    try {
      callProvider(
          OPERATION_DELETE,
          () -> {
            domainProvider.delete(referenceId);
            return null;
          });
      return CleanupResult.succeeded(referenceId);
    } catch (DomainProviderException ex) {
      // 古い登録が残っても新しい操作は止めない
      final CleanupResult result = CleanupResult.failed(referenceId, ex.getMessage());
      logger.warn(
          "domain registration cleanup failed customerId={} referenceId={} reason={} message={}",
          customerId,
          referenceId,
          ex.reason(),
          result.failureMessage());
      return result;
    }
  }

  private <T> T callProvider(String operation, Supplier<T> call) {
    try {
      final T result = call.get();
      metrics.recordProviderCall(operation, "success");
      return result;
    } catch (DomainProviderException ex) {
      metrics.recordProviderCall(operation, ex.reason().name().toLowerCase(Locale.ROOT));
      logger.warn(
          "domain provider {} failed reason={} providerMessage={}",
          operation,
          ex.reason(),
          ex.providerMessage());
      throw ex;
    }
  }

  private void requireTransition(String customerId, DomainState current, DomainState next) {
    if (!current.canTransitionTo(next)) {
      throw new IllegalStateException(
          "illegal domain state transition customerId="
              + customerId
              + " from="
              + current
              + " to="
              + next);
    }
  }

  private CustomerRecord findCustomer(String customerId) {
    return customerRepository
        .findById(customerId)
        .orElseThrow(() -> ResourceNotFoundException.customer(customerId));
  }
}
