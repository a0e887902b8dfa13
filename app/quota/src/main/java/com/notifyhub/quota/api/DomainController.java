/*
 * どこで: Quota API
 * 何を: 送信ドメインの登録/検証確認/参照/削除のエンドポイントを提供する
 * なぜ: 設定画面から DNS 検証の進行を操作できるようにするため
 */
package com.notifyhub.quota.api;

import com.notifyhub.quota.service.DomainVerificationWorkflow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/customers/{customer_id}/domain")
@RequiredArgsConstructor
@Validated
public class DomainController {

  private final DomainVerificationWorkflow domainVerificationWorkflow;

  @PostMapping
  public DomainRequestResponse request(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId,
      @Valid @RequestBody DomainRequest request) {
    return DomainRequestResponse.from(
        domainVerificationWorkflow.request(customerId, request.domain()));
  }

  @PostMapping("/verification")
  public DomainVerificationResponse verify(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId) {
    return DomainVerificationResponse.from(
        domainVerificationWorkflow.checkVerification(customerId));
  }

  @GetMapping
  public DomainStatusResponse status(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId) {
    return DomainStatusResponse.from(domainVerificationWorkflow.getStatus(customerId));
  }

  @DeleteMapping
  public MessageResponse remove(
      @PathVariable("customer_id") @NotBlank(message = "customer_id is required")
          String customerId) {
    return new MessageResponse(domainVerificationWorkflow.removeDomain(customerId));
  }
}
