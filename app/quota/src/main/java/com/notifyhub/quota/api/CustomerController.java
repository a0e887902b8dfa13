/*
 * どこで: Quota API
 * 何を: 顧客登録、使用量参照、送信認証情報、送信許可のエンドポイントを提供する
 * なぜ: 認証/ジョブ投入サービスからクォータエンジンを呼べるようにするため
 */
package com.notifyhub.quota.api;

import com.notifyhub.quota.service.CustomerService;
import com.notifyhub.quota.service.SendAuthorizationService;
import com.notifyhub.quota.service.UsageTracker;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/customers")
@RequiredArgsConstructor
@Validated
public class CustomerController {

  private final CustomerService customerService;
  private final UsageTracker usageTracker;
  private final SendAuthorizationService sendAuthorizationService;

  @PostMapping
  public ResponseEntity<CustomerResponse> register(
      @Valid @RequestBody RegisterCustomerRequest request) {
    final CustomerResponse response =
        CustomerResponse.from(customerService.register(request.customerId()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/{customer_id}/usage")
  public UsageResponse usage(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId) {
    return UsageResponse.from(usageTracker.getUsageStats(customerId));
  }

  @PutMapping("/{customer_id}/send-credential")
  public ResponseEntity<Void> storeSendCredential(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody SendCredentialRequest request) {
    customerService.storeSendCredential(customerId, request.apiKey());
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{customer_id}/send-credential")
  public ResponseEntity<Void> clearSendCredential(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId) {
    customerService.clearSendCredential(customerId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{customer_id}/send-authorizations")
  public SendAuthorizationResponse authorizeSend(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @RequestBody(required = false) SendAuthorizationRequest request) {
    final SendAuthorizationRequest resolved =
        request == null ? new SendAuthorizationRequest(null, false) : request;
    return SendAuthorizationResponse.from(
        sendAuthorizationService.authorize(customerId, resolved.toSendRequest()));
  }
}
