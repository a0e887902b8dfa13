/*
 * どこで: Quota 管理 API の Web 層テスト
 * 何を: 使用量リセット/ダウングレード/プラン変更/上限上書き/サブスクリプション更新の入力検証を検証する
 * なぜ: 運用者の誤入力がサービス層まで届かないことを保証するため
 */
package com.notifyhub.quota.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.notifyhub.quota.model.CustomerPlan;
import com.notifyhub.quota.model.CustomerRecords;
import com.notifyhub.quota.model.DowngradeReason;
import com.notifyhub.quota.model.SubscriptionStatus;
import com.notifyhub.quota.service.CustomerService;
import com.notifyhub.quota.service.UsageTracker;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminCustomerController.class)
@Import(ApiExceptionHandler.class)
class AdminCustomerControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CustomerService customerService;
  @MockitoBean private UsageTracker usageTracker;

  @Test
  void usageResetWithoutBodyStartsNewCycle() throws Exception {
    when(customerService.get("c1"))
        .thenReturn(CustomerRecords.customer("c1", CustomerPlan.INDIE).build());

    mockMvc
        .perform(post("/v1/admin/customers/c1/usage-reset"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("c1"));

    verify(usageTracker).resetMonthlyUsage("c1");
    verify(customerService, never()).overrideUsage(any(), anyInt());
  }

  @Test
  void usageResetWithCountOverridesUsage() throws Exception {
    when(customerService.overrideUsage("c1", 42))
        .thenReturn(CustomerRecords.customer("c1", CustomerPlan.INDIE).usage(42, 3000).build());

    mockMvc
        .perform(
            post("/v1/admin/customers/c1/usage-reset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"usage_count\":42}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.usage_count").value(42));

    verify(usageTracker, never()).resetMonthlyUsage(any());
  }

  @Test
  void usageResetRejectsNegativeCount() throws Exception {
    mockMvc
        .perform(
            post("/v1/admin/customers/c1/usage-reset")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"usage_count\":-1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("usage_count must be greater than or equal to 0"));
  }

  @Test
  void downgradeRequiresKnownReason() throws Exception {
    mockMvc
        .perform(
            post("/v1/admin/customers/c1/downgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"BORED\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));

    mockMvc
        .perform(
            post("/v1/admin/customers/c1/downgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("reason is required"));
  }

  @Test
  void downgradeReturnsUpdatedCustomer() throws Exception {
    when(customerService.get("c1"))
        .thenReturn(
            CustomerRecords.customer("c1", CustomerPlan.FREE)
                .previousPlan(CustomerPlan.STARTUP)
                .subscription(SubscriptionStatus.EXPIRED, null)
                .build());

    mockMvc
        .perform(
            post("/v1/admin/customers/c1/downgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"PAYMENT_FAILED\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.plan").value("FREE"))
        .andExpect(jsonPath("$.previous_plan").value("STARTUP"))
        .andExpect(jsonPath("$.subscription_status").value("EXPIRED"));

    verify(usageTracker).downgradeToFreePlan("c1", DowngradeReason.PAYMENT_FAILED);
  }

  @Test
  void planChangeRejectsUnknownPlan() throws Exception {
    mockMvc
        .perform(
            put("/v1/admin/customers/c1/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"plan\":\"ENTERPRISE\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void planChangeReturnsCatalogLimit() throws Exception {
    when(customerService.changePlan("c1", CustomerPlan.STARTUP))
        .thenReturn(CustomerRecords.customer("c1", CustomerPlan.STARTUP).build());

    mockMvc
        .perform(
            put("/v1/admin/customers/c1/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"plan\":\"STARTUP\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.monthly_limit").value(15000));
  }

  @Test
  void monthlyLimitMustBePositive() throws Exception {
    mockMvc
        .perform(
            put("/v1/admin/customers/c1/monthly-limit")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"monthly_limit\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("monthly_limit must be greater than 0"));

    verify(customerService, never()).overrideMonthlyLimit(any(), anyInt());
  }

  @Test
  void subscriptionUpdateIsForwarded() throws Exception {
    final Instant endDate = Instant.parse("2026-05-01T00:00:00Z");
    when(customerService.updateSubscription("c1", SubscriptionStatus.ACTIVE, endDate))
        .thenReturn(
            CustomerRecords.customer("c1", CustomerPlan.INDIE)
                .subscription(SubscriptionStatus.ACTIVE, endDate)
                .build());

    mockMvc
        .perform(
            put("/v1/admin/customers/c1/subscription")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"subscription_status":"ACTIVE","subscription_end_date":"2026-05-01T00:00:00Z"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subscription_status").value("ACTIVE"))
        .andExpect(jsonPath("$.subscription_end_date").value("2026-05-01T00:00:00Z"));
  }

  @Test
  void unknownCustomerIsNotFound() throws Exception {
    when(customerService.overrideMonthlyLimit("missing", 500))
        .thenThrow(ResourceNotFoundException.customer("missing"));

    mockMvc
        .perform(
            put("/v1/admin/customers/missing/monthly-limit")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"monthly_limit\":500}"))
        .andExpect(status().isNotFound());
  }
}
