/*
 * どこで: Quota ドメインモデル
 * 何を: DNS 設定手順の固定文言を表す
 * なぜ: ドメイン登録応答に毎回同じ案内を添えるため
 */
package com.notifyhub.quota.model;

import java.util.List;

public record DomainSetupInstructions(String message, List<String> steps, String estimatedTime) {

  public static final DomainSetupInstructions DEFAULT =
      new DomainSetupInstructions(
          "Add these DNS records to your domain registrar",
          List.of(
              "1. Login to your domain registrar (Namecheap, GoDaddy, Cloudflare, etc.)",
              "2. Navigate to DNS settings for your domain",
              "3. Add each CNAME record below",
              "4. Wait 15-60 minutes for DNS propagation",
              "5. Click \"Verify Domain\" to check status"),
          "15-60 minutes");

  public DomainSetupInstructions {
    steps = List.copyOf(steps);
  }
}
