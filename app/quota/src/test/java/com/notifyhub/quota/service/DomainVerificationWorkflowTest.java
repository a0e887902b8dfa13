/*
 * どこで: DomainVerificationWorkflow のユニットテスト
 * 何を: ドメイン登録/検証確認/削除の状態遷移とプロバイダ失敗時の扱いを検証する
 * なぜ: 古い登録の削除失敗で処理が止まらず、検証済みが未検証へ戻らないことを保証するため
 */
package com.notifyhub.quota.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.notifyhub.quota.api.DomainConflictException;
import com.notifyhub.quota.api.InvalidQuotaRequestException;
import com.notifyhub.quota.api.ResourceNotFoundException;
import com.notifyhub.quota.model.AuditAction;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecords;
import com.notifyhub.quota.model.DnsRecord;
import com.notifyhub.quota.model.DomainRequestResult;
import com.notifyhub.quota.model.DomainSetupInstructions;
import com.notifyhub.quota.model.DomainState;
import com.notifyhub.quota.model.DomainVerificationResult;
import com.notifyhub.quota.provider.DomainAuthentication;
import com.notifyhub.quota.provider.DomainAuthenticationProvider;
import com.notifyhub.quota.provider.DomainProviderException;
import com.notifyhub.quota.provider.DomainValidation;
import com.notifyhub.quota.repository.CustomerRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class DomainVerificationWorkflowTest {

  private static final Instant NOW = Instant.parse("2026-04-01T00:00:00Z");
  private static final String DOMAIN = "mail.example.com";
  private static final List<DnsRecord> RECORDS =
      List.of(
          new DnsRecord("cname", "em1." + DOMAIN, "u1.wl.sendgrid.net"),
          new DnsRecord("cname", "s1._domainkey." + DOMAIN, "s1.domainkey.u1.wl.sendgrid.net"),
          new DnsRecord("cname", "s2._domainkey." + DOMAIN, "s2.domainkey.u1.wl.sendgrid.net"));

  @Mock private CustomerRepository customerRepository;
  @Mock private DomainAuthenticationProvider domainProvider;
  @Mock private CustomerAuditor auditor;
  @Mock private PlatformTransactionManager transactionManager;

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private DomainVerificationWorkflow workflow;

  @BeforeEach
  void setUp() {
    workflow =
        new DomainVerificationWorkflow(
            customerRepository,
            domainProvider,
            auditor,
            new QuotaMetrics(registry),
            Clock.fixed(NOW, ZoneOffset.UTC),
            transactionManager);
  }

  @Test
  void requestRejectsFreePlanBeforeCallingProvider() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.FREE).build()));

    assertThatThrownBy(() -> workflow.request("c1", DOMAIN))
        .isInstanceOf(InvalidQuotaRequestException.class)
        .hasMessage(DomainVerificationWorkflow.MESSAGE_FREE_PLAN);
    verifyNoInteractions(domainProvider);
  }

  @Test
  void requestRejectsMalformedDomain() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));

    assertThatThrownBy(() -> workflow.request("c1", "not a domain"))
        .isInstanceOf(InvalidQuotaRequestException.class);
    verifyNoInteractions(domainProvider);
  }

  @Test
  void requestRejectsDomainVerifiedByAnotherCustomer() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(true);

    assertThatThrownBy(() -> workflow.request("c1", "Mail.Example.com"))
        .isInstanceOf(DomainConflictException.class);
    verifyNoInteractions(domainProvider);
  }

  @Test
  void requestStoresPendingRegistrationWithInstructions() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.STARTUP).build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-1", RECORDS, false));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-1", RECORDS, false, NOW))
        .thenReturn(1);

    final DomainRequestResult result = workflow.request("c1", " " + DOMAIN + " ");

    assertThat(result.domain()).isEqualTo(DOMAIN);
    assertThat(result.state()).isEqualTo(DomainState.REQUESTED);
    assertThat(result.verified()).isFalse();
    assertThat(result.dnsRecords()).hasSize(3);
    assertThat(result.dnsRecords().get(0).id()).isEqualTo(1);
    assertThat(result.dnsRecords().get(1).description()).startsWith("DKIM 1");
    assertThat(result.instructions()).isEqualTo(DomainSetupInstructions.DEFAULT);
    assertThat(result.previousRegistrationCleanup().attempted()).isFalse();
    verify(auditor)
        .record(eq("c1"), eq(AuditAction.DOMAIN_REQUESTED), isNull(), anyMap(), eq(NOW));
    verify(auditor, never())
        .record(any(), eq(AuditAction.DOMAIN_VERIFIED), any(), anyMap(), any());
    assertThat(
            registry
                .get(QuotaMetrics.METRIC_PROVIDER_CALL)
                .tags("operation", "authenticate", "result", "success")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void requestIsVerifiedImmediatelyWhenProviderReportsValid() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-1", RECORDS, true));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-1", RECORDS, true, NOW))
        .thenReturn(1);

    final DomainRequestResult result = workflow.request("c1", DOMAIN);

    assertThat(result.state()).isEqualTo(DomainState.VERIFIED);
    verify(auditor)
        .record("c1", AuditAction.DOMAIN_VERIFIED, "initial", Map.of("domain", DOMAIN), NOW);
  }

  @Test
  void reRequestContinuesWhenOldRegistrationCleanupFails() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain("old.example.com", "dom-old", false)
                    .build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    doThrow(
            new DomainProviderException(
                DomainProviderException.Reason.BAD_GATEWAY, "provider unavailable", "503"))
        .when(domainProvider)
        .delete("dom-old");
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-2", RECORDS, false));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-2", RECORDS, false, NOW))
        .thenReturn(1);

    final DomainRequestResult result = workflow.request("c1", DOMAIN);

    assertThat(result.previousRegistrationCleanup().attempted()).isTrue();
    assertThat(result.previousRegistrationCleanup().succeeded()).isFalse();
    assertThat(result.previousRegistrationCleanup().referenceId()).isEqualTo("dom-old");
    assertThat(
            registry
                .get(QuotaMetrics.METRIC_PROVIDER_CALL)
                .tags("operation", "delete", "result", "bad_gateway")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void providerFailureOnAuthenticatePropagatesWithoutSaving() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenThrow(
            new DomainProviderException(DomainProviderException.Reason.TIMEOUT, "timeout", null));

    assertThatThrownBy(() -> workflow.request("c1", DOMAIN))
        .isInstanceOf(DomainProviderException.class);
    verify(customerRepository, never())
        .saveDomainRequest(anyString(), anyString(), anyString(), anyList(), anyBoolean(), any());
  }

  @Test
  void authenticateFailureLeavesExistingRegistrationInPlace() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-old", true)
                    .build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenThrow(
            new DomainProviderException(DomainProviderException.Reason.TIMEOUT, "timeout", null));

    assertThatThrownBy(() -> workflow.request("c1", DOMAIN))
        .isInstanceOf(DomainProviderException.class);

    verify(domainProvider, never()).delete(anyString());
    verify(customerRepository, never()).clearDomain(anyString(), any());
    verifyNoInteractions(auditor);
  }

  @Test
  void reRequestDeletesOldRegistrationOnlyAfterNewOneIsSaved() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-old", true)
                    .build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-2", RECORDS, false));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-2", RECORDS, false, NOW))
        .thenReturn(1);

    final DomainRequestResult result = workflow.request("c1", DOMAIN);

    final InOrder order = inOrder(domainProvider, customerRepository, transactionManager);
    order.verify(domainProvider).authenticate(DOMAIN);
    order.verify(customerRepository).saveDomainRequest("c1", DOMAIN, "dom-2", RECORDS, false, NOW);
    order.verify(transactionManager).commit(any());
    order.verify(domainProvider).delete("dom-old");
    assertThat(result.previousRegistrationCleanup().succeeded()).isTrue();
    assertThat(result.previousRegistrationCleanup().referenceId()).isEqualTo("dom-old");
  }

  @Test
  void reRequestKeepsRegistrationWhenProviderReturnsSameReference() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-1", false)
                    .build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-1", RECORDS, false));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-1", RECORDS, false, NOW))
        .thenReturn(1);

    final DomainRequestResult result = workflow.request("c1", DOMAIN);

    assertThat(result.previousRegistrationCleanup().attempted()).isFalse();
    verify(domainProvider, never()).delete(anyString());
  }

  @Test
  void auditFailureRollsBackSaveAndDiscardsNewRegistration() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain("old.example.com", "dom-old", false)
                    .build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-2", RECORDS, false));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-2", RECORDS, false, NOW))
        .thenReturn(1);
    doThrow(new DataAccessResourceFailureException("audit insert failed"))
        .when(auditor)
        .record(eq("c1"), eq(AuditAction.DOMAIN_REQUESTED), isNull(), anyMap(), eq(NOW));

    assertThatThrownBy(() -> workflow.request("c1", DOMAIN))
        .isInstanceOf(DataAccessResourceFailureException.class);

    verify(transactionManager).rollback(any());
    verify(transactionManager, never()).commit(any());
    verify(domainProvider).delete("dom-2");
    verify(domainProvider, never()).delete("dom-old");
  }

  @Test
  void uniqueViolationOnSaveBecomesConflict() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));
    when(customerRepository.existsVerifiedDomainForOtherCustomer(DOMAIN, "c1")).thenReturn(false);
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(new DomainAuthentication("dom-1", RECORDS, true));
    when(customerRepository.saveDomainRequest("c1", DOMAIN, "dom-1", RECORDS, true, NOW))
        .thenThrow(new DuplicateKeyException("uq_customers_verified_domain"));

    assertThatThrownBy(() -> workflow.request("c1", DOMAIN))
        .isInstanceOf(DomainConflictException.class);
    // 保存できなかった新しい登録はプロバイダ側からも消す
    verify(domainProvider).delete("dom-1");
  }

  @Test
  void checkVerificationWithoutDomainIsNotFound() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));

    assertThatThrownBy(() -> workflow.checkVerification("c1"))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessage(DomainVerificationWorkflow.MESSAGE_NO_DOMAIN);
  }

  @Test
  void checkVerificationReturnsPerRecordDetailsWhilePending() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-1", false)
                    .build()));
    when(domainProvider.validate("dom-1"))
        .thenReturn(
            new DomainValidation(
                false,
                Map.of(
                    "mail_cname",
                    new DomainValidation.RecordValidation(false, "Expected CNAME not found"))));

    final DomainVerificationResult result = workflow.checkVerification("c1");

    assertThat(result.verified()).isFalse();
    assertThat(result.state()).isEqualTo(DomainState.PENDING);
    assertThat(result.message()).isEqualTo(DomainVerificationResult.MESSAGE_NOT_VERIFIED);
    assertThat(result.validationResults())
        .containsEntry(
            "mail_cname",
            new DomainVerificationResult.RecordCheck(false, "Expected CNAME not found"));
    verify(customerRepository).markDomainChecked("c1", false, NOW);
    verifyNoInteractions(auditor);
  }

  @Test
  void checkVerificationMarksNewlyVerifiedDomain() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-1", false)
                    .domainCheckedAt(CustomerRecords.BASE_TIME)
                    .build()));
    when(domainProvider.validate("dom-1")).thenReturn(new DomainValidation(true, null));

    final DomainVerificationResult result = workflow.checkVerification("c1");

    assertThat(result.verified()).isTrue();
    assertThat(result.state()).isEqualTo(DomainState.VERIFIED);
    assertThat(result.validationResults()).isNull();
    verify(auditor)
        .record("c1", AuditAction.DOMAIN_VERIFIED, "validated", Map.of("domain", DOMAIN), NOW);
  }

  @Test
  void checkVerificationKeepsVerifiedDomainVerifiedWhenDnsRegresses() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-1", true)
                    .build()));
    when(domainProvider.validate("dom-1")).thenReturn(new DomainValidation(false, Map.of()));

    final DomainVerificationResult result = workflow.checkVerification("c1");

    assertThat(result.verified()).isFalse();
    assertThat(result.state()).isEqualTo(DomainState.VERIFIED);
    verify(customerRepository).markDomainChecked("c1", false, NOW);
  }

  @Test
  void removeDomainClearsColumnsEvenWhenProviderDeleteFails() {
    when(customerRepository.findById("c1"))
        .thenReturn(
            Optional.of(
                CustomerRecords.customer("c1", CustomerPlan.INDIE)
                    .domain(DOMAIN, "dom-1", true)
                    .build()));
    doThrow(
            new DomainProviderException(
                DomainProviderException.Reason.REJECTED, "not found", "resource not found"))
        .when(domainProvider)
        .delete("dom-1");

    assertThat(workflow.removeDomain("c1")).isEqualTo(DomainVerificationWorkflow.MESSAGE_REMOVED);

    verify(customerRepository).clearDomain("c1", NOW);
    verify(auditor).record(eq("c1"), eq(AuditAction.DOMAIN_REMOVED), isNull(), anyMap(), eq(NOW));
    verify(transactionManager).commit(any());
  }

  @Test
  void removeDomainWithoutDomainSucceedsWithoutAudit() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));

    assertThat(workflow.removeDomain("c1")).isEqualTo(DomainVerificationWorkflow.MESSAGE_REMOVED);

    verifyNoInteractions(domainProvider, auditor);
    verify(customerRepository).clearDomain("c1", NOW);
  }

  @Test
  void statusOfCustomerWithoutDomainIsNone() {
    when(customerRepository.findById("c1"))
        .thenReturn(Optional.of(CustomerRecords.customer("c1", CustomerPlan.INDIE).build()));

    assertThat(workflow.getStatus("c1").hasDomain()).isFalse();
    assertThat(workflow.getStatus("c1").state()).isEqualTo(DomainState.NONE);
  }
}
