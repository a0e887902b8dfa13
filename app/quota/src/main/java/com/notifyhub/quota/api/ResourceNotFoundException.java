/*
 * どこで: Quota API
 * 何を: 顧客やドメインが存在しないことを表す
 * なぜ: 404 応答に一貫して変換するため
 */
package com.notifyhub.quota.api;

public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }

  public static ResourceNotFoundException customer(String customerId) {
    return new ResourceNotFoundException("customer not found: " + customerId);
  }
}
