package io.b2mash.credits.ledger;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Ledger client for a remote ledger service:
 *
 * <ul>
 *   <li>{@code POST /grants} with {@code {userId, amount, reason, idempotencyKey}} returns {@code
 *       {grantId, duplicate}}
 *   <li>{@code POST /grants/lookup} with {@code {idempotencyKeys}} returns {@code {granted}}
 *   <li>{@code POST /grants/totals} with {@code {scheduleId, userIds}} returns {@code {totals}}, a
 *       map of user id to amount granted under that schedule
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "credits.ledger.provider", havingValue = "http")
public class HttpCreditLedgerClient implements CreditLedgerClient {

  private static final Logger log = LoggerFactory.getLogger(HttpCreditLedgerClient.class);

  private final RestClient restClient;

  @Autowired
  public HttpCreditLedgerClient(RestClient.Builder builder, CreditLedgerProperties properties) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException(
          "credits.ledger.base-url is required when credits.ledger.provider=http");
    }
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    builder = builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
    }
    this.restClient = builder.build();
  }

  HttpCreditLedgerClient(RestClient restClient) {
    this.restClient = restClient;
  }

  record LookupRequest(Collection<String> idempotencyKeys) {}

  record LookupResponse(List<String> granted) {}

  record TotalsRequest(UUID scheduleId, Collection<String> userIds) {}

  record TotalsResponse(Map<String, BigDecimal> totals) {}

  @Override
  public String providerId() {
    return "http";
  }

  @Override
  public GrantReceipt grant(GrantRequest request) {
    try {
      var receipt =
          restClient
              .post()
              .uri("/grants")
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(GrantReceipt.class);
      if (receipt == null) {
        throw new LedgerGrantException(
            "Ledger returned an empty response for " + request.idempotencyKey(), true);
      }
      return receipt;
    } catch (RestClientResponseException e) {
      boolean transientFailure = isTransient(e.getStatusCode());
      log.debug(
          "Ledger rejected grant {} with HTTP {} (transient={})",
          request.idempotencyKey(),
          e.getStatusCode().value(),
          transientFailure);
      throw new LedgerGrantException(
          "Ledger returned HTTP " + e.getStatusCode().value() + " for " + request.idempotencyKey(),
          transientFailure,
          e);
    } catch (ResourceAccessException e) {
      throw new LedgerGrantException(
          "Ledger unreachable for " + request.idempotencyKey() + ": " + e.getMessage(), true, e);
    }
  }

  @Override
  public Set<String> findGrantedKeys(Collection<String> idempotencyKeys) {
    if (idempotencyKeys.isEmpty()) {
      return Set.of();
    }
    var response =
        restClient
            .post()
            .uri("/grants/lookup")
            .contentType(MediaType.APPLICATION_JSON)
            .body(new LookupRequest(idempotencyKeys))
            .retrieve()
            .body(LookupResponse.class);
    if (response == null || response.granted() == null) {
      return Set.of();
    }
    return Set.copyOf(response.granted());
  }

  @Override
  public Map<String, BigDecimal> findGrantedTotals(UUID scheduleId, Collection<String> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    var response =
        restClient
            .post()
            .uri("/grants/totals")
            .contentType(MediaType.APPLICATION_JSON)
            .body(new TotalsRequest(scheduleId, userIds))
            .retrieve()
            .body(TotalsResponse.class);
    if (response == null || response.totals() == null) {
      return Map.of();
    }
    return response.totals();
  }

  static boolean isTransient(HttpStatusCode status) {
    return status.is5xxServerError() || status.value() == 408 || status.value() == 429;
  }
}
