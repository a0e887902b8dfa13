/*
 * どこで: Quota 外部連携
 * 何を: SendGrid の whitelabel domains API を呼び出すクライアント
 * なぜ: ドメイン認証の登録/検証/削除を DomainAuthenticationProvider として提供するため
 */
package com.notifyhub.quota.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.quota.config.DomainProviderProperties;
import com.notifyhub.quota.model.DnsRecord;
import com.notifyhub.quota.provider.dto.SendGridDomainRequest;
import com.notifyhub.quota.provider.dto.SendGridDomainResponse;
import com.notifyhub.quota.provider.dto.SendGridErrorResponse;
import com.notifyhub.quota.provider.dto.SendGridValidationResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class SendGridDomainClient implements DomainAuthenticationProvider {

  private static final Logger logger = LoggerFactory.getLogger(SendGridDomainClient.class);

  private static final String OPERATION_AUTHENTICATE = "authenticate";
  private static final String OPERATION_VALIDATE = "validate";
  private static final String OPERATION_DELETE = "delete";

  private final RestClient domainProviderRestClient;
  private final DomainProviderProperties properties;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient と ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SendGridDomainClient(
      RestClient domainProviderRestClient,
      DomainProviderProperties properties,
      ObjectMapper objectMapper) {
    this.domainProviderRestClient = domainProviderRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public DomainAuthentication authenticate(String domain) {
    requireText(domain, "domain");
    final SendGridDomainRequest request =
        new SendGridDomainRequest(domain, properties.subdomain(), true, false, false);
    final SendGridDomainResponse response =
        call(
            OPERATION_AUTHENTICATE,
            () ->
                domainProviderRestClient
                    .post()
                    .uri(properties.authenticatePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(SendGridDomainResponse.class));
    final DomainAuthentication authentication = toAuthentication(response);
    logger.info(
        "domain authentication initiated domain={} referenceId={} valid={}",
        domain,
        authentication.referenceId(),
        authentication.valid());
    return authentication;
  }

  @Override
  public DomainValidation validate(String referenceId) {
    requireText(referenceId, "referenceId");
    final SendGridValidationResponse response =
        call(
            OPERATION_VALIDATE,
            () ->
                domainProviderRestClient
                    .post()
                    .uri(properties.validatePath(), referenceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of())
                    .retrieve()
                    .body(SendGridValidationResponse.class));
    if (response == null || response.valid() == null) {
      throw invalidResponse(OPERATION_VALIDATE);
    }
    final Map<String, DomainValidation.RecordValidation> results = new LinkedHashMap<>();
    if (response.validationResults() != null) {
      response
          .validationResults()
          .forEach(
              (name, result) ->
                  results.put(
                      name,
                      new DomainValidation.RecordValidation(
                          Boolean.TRUE.equals(result.valid()), result.reason())));
    }
    logger.info(
        "domain validation result referenceId={} valid={}", referenceId, response.valid());
    return new DomainValidation(response.valid(), results);
  }

  @Override
  public void delete(String referenceId) {
    requireText(referenceId, "referenceId");
    call(
        OPERATION_DELETE,
        () ->
            domainProviderRestClient
                .delete()
                .uri(properties.deletePath(), referenceId)
                .retrieve()
                .toBodilessEntity());
    logger.info("domain authentication deleted referenceId={}", referenceId);
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (DomainProviderException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("domain provider {} response parse failed", operation, ex);
      throw new DomainProviderException(
          DomainProviderException.Reason.INVALID_RESPONSE,
          "domain provider " + operation + " response parse failed",
          null,
          ex);
    }
  }

  private DomainAuthentication toAuthentication(SendGridDomainResponse response) {
    if (response == null || response.id() == null || response.dns() == null) {
      throw invalidResponse(OPERATION_AUTHENTICATE);
    }
    final SendGridDomainResponse.Dns dns = response.dns();
    // 並び順は mail_cname, dkim1, dkim2 で固定し、説明文の位置と対応させる。
    final List<DnsRecord> records =
        List.of(toRecord(dns.mailCname()), toRecord(dns.dkim1()), toRecord(dns.dkim2()));
    return new DomainAuthentication(
        String.valueOf(response.id()), records, Boolean.TRUE.equals(response.valid()));
  }

  private DnsRecord toRecord(SendGridDomainResponse.DnsEntry entry) {
    if (entry == null || isBlank(entry.host()) || isBlank(entry.data())) {
      throw invalidResponse(OPERATION_AUTHENTICATE);
    }
    return new DnsRecord(entry.type(), entry.host(), entry.data());
  }

  private DomainProviderException invalidResponse(String operation) {
    return new DomainProviderException(
        DomainProviderException.Reason.INVALID_RESPONSE,
        "domain provider " + operation + " response is invalid",
        null);
  }

  private DomainProviderException mapResponseException(
      String operation, RestClientResponseException ex) {
    final String providerMessage = extractProviderMessage(ex);
    logger.warn(
        "domain provider {} failed with http status={} providerMessage={}",
        operation,
        ex.getStatusCode().value(),
        providerMessage);
    final String message = failureMessage(operation, providerMessage, ex.getStatusText());
    if (ex.getStatusCode().is5xxServerError()) {
      return new DomainProviderException(
          DomainProviderException.Reason.BAD_GATEWAY, message, providerMessage, ex);
    }
    if (ex.getStatusCode().value() == 429) {
      return new DomainProviderException(
          DomainProviderException.Reason.BAD_GATEWAY, message, providerMessage, ex);
    }
    return new DomainProviderException(
        DomainProviderException.Reason.REJECTED, message, providerMessage, ex);
  }

  private DomainProviderException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("domain provider {} timed out", operation);
      return new DomainProviderException(
          DomainProviderException.Reason.TIMEOUT,
          "domain provider " + operation + " request timeout",
          null,
          ex);
    }
    logger.warn("domain provider {} connection failed", operation, ex);
    return new DomainProviderException(
        DomainProviderException.Reason.BAD_GATEWAY,
        "domain provider " + operation + " connection failed",
        null,
        ex);
  }

  private String extractProviderMessage(RestClientResponseException ex) {
    final String body = ex.getResponseBodyAsString();
    if (isBlank(body)) {
      return null;
    }
    try {
      return objectMapper.readValue(body, SendGridErrorResponse.class).firstMessage();
    } catch (JsonProcessingException parseFailure) {
      logger.debug("domain provider error body is not JSON", parseFailure);
      return null;
    }
  }

  private String failureMessage(String operation, String providerMessage, String fallback) {
    final String detail = isBlank(providerMessage) ? fallback : providerMessage;
    return "Failed to " + operation + " domain: " + detail;
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void requireText(String value, String name) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
