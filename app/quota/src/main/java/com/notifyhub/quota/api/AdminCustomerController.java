/*
 * どこで: Quota 管理 API
 * 何を: 使用量リセット、強制ダウングレード、プラン/上限/サブスクリプション変更のエンドポイントを提供する
 * なぜ: 運用者の手動操作を監査付きの明示的な変更として受け付けるため
 */
package com.notifyhub.quota.api;

import com.notifyhub.quota.service.CustomerService;
import com.notifyhub.quota.service.UsageTracker;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/customers/{customer_id}")
@RequiredArgsConstructor
@Validated
public class AdminCustomerController {

  private final CustomerService customerService;
  private final UsageTracker usageTracker;

  @PostMapping("/usage-reset")
  public CustomerResponse resetUsage(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody(required = false) UsageResetRequest request) {
    if (request == null || request.usageCount() == null) {
      usageTracker.resetMonthlyUsage(customerId);
      return CustomerResponse.from(customerService.get(customerId));
    }
    return CustomerResponse.from(customerService.overrideUsage(customerId, request.usageCount()));
  }

  @PostMapping("/downgrade")
  public CustomerResponse downgrade(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody DowngradeRequest request) {
    usageTracker.downgradeToFreePlan(customerId, request.reason());
    return CustomerResponse.from(customerService.get(customerId));
  }

  @PutMapping("/plan")
  public CustomerResponse changePlan(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody PlanChangeRequest request) {
    return CustomerResponse.from(customerService.changePlan(customerId, request.plan()));
  }

  @PutMapping("/monthly-limit")
  public CustomerResponse overrideMonthlyLimit(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody MonthlyLimitRequest request) {
    return CustomerResponse.from(
        customerService.overrideMonthlyLimit(customerId, request.monthlyLimit()));
  }

  @PutMapping("/subscription")
  public CustomerResponse updateSubscription(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody SubscriptionUpdateRequest request) {
    return CustomerResponse.from(
        customerService.updateSubscription(
            customerId, request.subscriptionStatus(), request.subscriptionEndDate()));
  }
}
