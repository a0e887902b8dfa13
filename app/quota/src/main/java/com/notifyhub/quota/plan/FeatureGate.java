/*
 * どこで: Quota 機能ゲート
 * 何を: プランと機能マトリクスからテナントの操作可否を判定する
 * なぜ: 送信経路が毎リクエスト遅延なしで呼べる同期の判定を提供するため
 */
package com.notifyhub.quota.plan;

import com.notifyhub.quota.api.PlanRestrictedException;
import com.notifyhub.quota.model.CustomerPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FeatureGate {

  static final String SEND_CREDENTIAL = "send_credential";

  static final String MESSAGE_CREDENTIAL_MISSING =
      "Please add your SendGrid API key in Settings before sending emails.";
  static final String MESSAGE_CUSTOM_DOMAIN_FREE =
      "Custom sending domains are only available on paid plans. Please upgrade to continue.";
  static final String MESSAGE_DOMAIN_MISSING =
      "Paid plans must use a verified sending domain."
          + " Please add and verify your domain in Settings.";
  static final String MESSAGE_DOMAIN_PENDING =
      "Your sending domain is pending verification."
          + " Please complete domain verification in Settings.";
  static final String MESSAGE_PRIORITY_QUEUE_FREE =
      "Priority queue is only available on paid plans. Please upgrade to continue.";
  static final String MESSAGE_FEATURE_UNAVAILABLE =
      "This feature is not available on your current plan.";

  private final FeatureMatrix featureMatrix;

  public GateDecision checkSendCredential(GateContext context) {
    if (context.plan() != CustomerPlan.FREE && !context.hasSendCredential()) {
      return GateDecision.deny(SEND_CREDENTIAL, MESSAGE_CREDENTIAL_MISSING);
    }
    return GateDecision.allow(SEND_CREDENTIAL);
  }

  public GateDecision checkCustomDomain(GateContext context) {
    if (context.plan() == CustomerPlan.FREE) {
      return GateDecision.deny(Features.CUSTOM_DOMAIN, MESSAGE_CUSTOM_DOMAIN_FREE);
    }
    if (!context.hasSendingDomain()) {
      return GateDecision.deny(Features.CUSTOM_DOMAIN, MESSAGE_DOMAIN_MISSING);
    }
    if (!context.domainVerified()) {
      return GateDecision.deny(Features.CUSTOM_DOMAIN, MESSAGE_DOMAIN_PENDING);
    }
    return GateDecision.allow(Features.CUSTOM_DOMAIN);
  }

  public GateDecision checkPriorityQueue(GateContext context) {
    if (context.plan() == CustomerPlan.FREE) {
      return GateDecision.deny(Features.PRIORITY_QUEUE, MESSAGE_PRIORITY_QUEUE_FREE);
    }
    return GateDecision.allow(Features.PRIORITY_QUEUE);
  }

  public GateDecision checkFeature(GateContext context, String feature) {
    if (!featureMatrix.isAllowed(feature, context.plan())) {
      return GateDecision.deny(feature, MESSAGE_FEATURE_UNAVAILABLE);
    }
    return GateDecision.allow(feature);
  }

  public void assertFeatureAllowed(GateContext context, String feature) {
    require(checkFeature(context, feature));
  }

  public void assertCanSendEmail(GateContext context) {
    require(checkSendCredential(context));
  }

  public void assertCanUseCustomDomain(GateContext context) {
    require(checkCustomDomain(context));
  }

  public void assertCanUsePriorityQueue(GateContext context) {
    require(checkPriorityQueue(context));
  }

  private void require(GateDecision decision) {
    if (!decision.allowed()) {
      throw new PlanRestrictedException(decision.feature(), decision.reason());
    }
  }
}
