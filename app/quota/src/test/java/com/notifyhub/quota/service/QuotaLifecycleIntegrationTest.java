/*
 * どこで: Quota サービス層の統合テスト
 * 何を: 登録からプラン変更、ドメイン検証、送信許可、上限到達、契約切れダウングレードまでを通しで検証する
 * なぜ: サービス間の連携と監査記録が実 DB 上で整合することを保証するため
 */
package com.notifyhub.quota.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.notifyhub.quota.AbstractPostgresContainerTest;
import com.notifyhub.quota.api.PlanRestrictedException;
import com.notifyhub.quota.api.QuotaExceededException;
import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecord;
import com.notifyhub.quota.model.DnsRecord;
import com.notifyhub.quota.model.RolloverOutcome;
import com.notifyhub.quota.model.SendAuthorization;
import com.notifyhub.quota.model.SubscriptionStatus;
import com.notifyhub.quota.model.UsageStats;
import com.notifyhub.quota.provider.DomainAuthentication;
import com.notifyhub.quota.provider.DomainAuthenticationProvider;
import com.notifyhub.quota.repository.CustomerRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class QuotaLifecycleIntegrationTest extends AbstractPostgresContainerTest {

  private static final String CUSTOMER_ID = "tenant-1";
  private static final String DOMAIN = "mail.example.com";

  @Autowired private CustomerService customerService;
  @Autowired private UsageTracker usageTracker;
  @Autowired private SendAuthorizationService sendAuthorizationService;
  @Autowired private DomainVerificationWorkflow domainWorkflow;
  @Autowired private BillingCycleService billingCycleService;
  @Autowired private CustomerRepository customerRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @MockitoBean private DomainAuthenticationProvider domainProvider;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM customer_audit", params);
    jdbcTemplate.update("DELETE FROM customers", params);
  }

  @Test
  void paidCustomerReachesLimitAfterLastAuthorizedSend() {
    customerService.register(CUSTOMER_ID);
    customerService.changePlan(CUSTOMER_ID, CustomerPlan.INDIE);
    customerService.updateSubscription(
        CUSTOMER_ID, SubscriptionStatus.ACTIVE, Instant.now().plus(Duration.ofDays(30)));
    customerService.storeSendCredential(CUSTOMER_ID, "SG.customer-key");
    when(domainProvider.authenticate(DOMAIN))
        .thenReturn(
            new DomainAuthentication(
                "dom-1", List.of(new DnsRecord("cname", "em1." + DOMAIN, "u1.wl")), true));
    assertThat(domainWorkflow.request(CUSTOMER_ID, DOMAIN).verified()).isTrue();
    customerService.overrideUsage(CUSTOMER_ID, 2999);

    final UsageStats before = usageTracker.getUsageStats(CUSTOMER_ID);
    assertThat(before.usage()).isEqualTo(2999);
    assertThat(before.limit()).isEqualTo(3000);
    assertThat(before.remaining()).isEqualTo(1);
    assertThat(before.percentageUsed()).isEqualTo(99.97);

    final SendAuthorization authorization =
        sendAuthorizationService.authorize(CUSTOMER_ID, null);
    assertThat(authorization.credential()).isEqualTo("SG.customer-key");
    assertThat(authorization.sendingDomain()).isEqualTo(DOMAIN);
    assertThat(authorization.remaining()).isZero();

    final UsageStats after = usageTracker.getUsageStats(CUSTOMER_ID);
    assertThat(after.usage()).isEqualTo(3000);
    assertThat(after.remaining()).isZero();
    assertThat(after.percentageUsed()).isEqualTo(100.0);

    assertThatThrownBy(() -> sendAuthorizationService.authorize(CUSTOMER_ID, null))
        .isInstanceOf(QuotaExceededException.class);
    assertThat(usageTracker.getUsageStats(CUSTOMER_ID).usage()).isEqualTo(3000);
  }

  @Test
  void paidCustomerWithoutVerifiedDomainIsRestricted() {
    customerService.register(CUSTOMER_ID);
    customerService.changePlan(CUSTOMER_ID, CustomerPlan.STARTUP);
    customerService.storeSendCredential(CUSTOMER_ID, "SG.customer-key");

    assertThatThrownBy(() -> sendAuthorizationService.authorize(CUSTOMER_ID, null))
        .isInstanceOf(PlanRestrictedException.class);
    assertThat(usageTracker.getUsageStats(CUSTOMER_ID).usage()).isZero();
  }

  @Test
  void lapsedSubscriptionIsDowngradedOnceBySweep() {
    customerService.register(CUSTOMER_ID);
    customerService.changePlan(CUSTOMER_ID, CustomerPlan.STARTUP);
    customerService.updateSubscription(
        CUSTOMER_ID, SubscriptionStatus.CANCELLED, Instant.now().minus(Duration.ofDays(10)));
    customerService.overrideUsage(CUSTOMER_ID, 500);
    expireCycle(CUSTOMER_ID);

    final Map<RolloverOutcome, Integer> first = billingCycleService.sweepDue();
    final Map<RolloverOutcome, Integer> second = billingCycleService.sweepDue();

    assertThat(first).containsEntry(RolloverOutcome.DOWNGRADED, 1);
    assertThat(second).isEmpty();
    final CustomerRecord stored = customerRepository.findById(CUSTOMER_ID).orElseThrow();
    assertThat(stored.plan()).isEqualTo(CustomerPlan.FREE);
    assertThat(stored.previousPlan()).isEqualTo(CustomerPlan.STARTUP);
    assertThat(stored.monthlyLimit()).isEqualTo(100);
    assertThat(stored.usageCount()).isZero();
    assertThat(stored.subscriptionStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
    assertThat(stored.usageResetAt()).isAfter(Instant.now());
    assertThat(countAudit(CUSTOMER_ID, "DOWNGRADED")).isEqualTo(1);
  }

  @Test
  void subscriptionInGracePeriodIsResetWithoutDowngrade() {
    customerService.register(CUSTOMER_ID);
    customerService.changePlan(CUSTOMER_ID, CustomerPlan.INDIE);
    customerService.updateSubscription(
        CUSTOMER_ID, SubscriptionStatus.PAST_DUE, Instant.now().minus(Duration.ofDays(2)));
    customerService.overrideUsage(CUSTOMER_ID, 1200);
    expireCycle(CUSTOMER_ID);

    assertThat(billingCycleService.sweepDue())
        .containsEntry(RolloverOutcome.RESET_IN_GRACE_PERIOD, 1);

    final CustomerRecord stored = customerRepository.findById(CUSTOMER_ID).orElseThrow();
    assertThat(stored.plan()).isEqualTo(CustomerPlan.INDIE);
    assertThat(stored.usageCount()).isZero();
    assertThat(countAudit(CUSTOMER_ID, "USAGE_RESET")).isEqualTo(1);
  }

  @Test
  void everyMutationIsAudited() {
    customerService.register(CUSTOMER_ID);
    customerService.register(CUSTOMER_ID);
    customerService.overrideMonthlyLimit(CUSTOMER_ID, 250);
    customerService.storeSendCredential(CUSTOMER_ID, "SG.key");
    customerService.clearSendCredential(CUSTOMER_ID);
    usageTracker.resetMonthlyUsage(CUSTOMER_ID);

    assertThat(countAudit(CUSTOMER_ID, "CREATED")).isEqualTo(1);
    assertThat(countAudit(CUSTOMER_ID, "LIMIT_OVERRIDDEN")).isEqualTo(1);
    assertThat(countAudit(CUSTOMER_ID, "CREDENTIAL_STORED")).isEqualTo(1);
    assertThat(countAudit(CUSTOMER_ID, "CREDENTIAL_CLEARED")).isEqualTo(1);
    assertThat(countAudit(CUSTOMER_ID, "USAGE_RESET")).isEqualTo(1);
    assertThat(customerRepository.findById(CUSTOMER_ID).orElseThrow().monthlyLimit())
        .isEqualTo(250);
  }

  private void expireCycle(String customerId) {
    jdbcTemplate.update(
        "UPDATE customers SET usage_reset_at = now() - INTERVAL '1 hour' WHERE id = :id",
        new MapSqlParameterSource("id", customerId));
  }

  private int countAudit(String customerId, String action) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM customer_audit WHERE customer_id = :id AND action = :action",
            new MapSqlParameterSource().addValue("id", customerId).addValue("action", action),
            Integer.class);
    return count == null ? 0 : count;
  }
}
