package io.b2mash.credits.ledger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process ledger used when no ledger service is configured. Remembers applied idempotency keys
 * for 40 days (longer than any period) so repeated grants are reported as duplicates.
 */
@Component
@ConditionalOnProperty(
    name = "credits.ledger.provider",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpCreditLedgerClient implements CreditLedgerClient {

  private static final Logger log = LoggerFactory.getLogger(NoOpCreditLedgerClient.class);

  private final Cache<String, String> appliedGrants =
      Caffeine.newBuilder().maximumSize(1_000_000).expireAfterWrite(Duration.ofDays(40)).build();

  // scheduleId:userId -> amount granted
  private final Cache<String, BigDecimal> scheduleTotals =
      Caffeine.newBuilder().maximumSize(1_000_000).expireAfterAccess(Duration.ofDays(400)).build();

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public GrantReceipt grant(GrantRequest request) {
    var newId = "NOOP-" + UUID.randomUUID();
    var grantId = appliedGrants.get(request.idempotencyKey(), key -> newId);
    boolean duplicate = !grantId.equals(newId);
    if (!duplicate) {
      var totalKey = totalKey(request.scheduleId(), request.userId());
      scheduleTotals.asMap().merge(totalKey, request.amount(), BigDecimal::add);
    }
    log.debug(
        "NoOp ledger: granted {} ({}) to user {}, key={}, duplicate={}",
        request.amount(),
        request.reason(),
        request.userId(),
        request.idempotencyKey(),
        duplicate);
    return new GrantReceipt(grantId, duplicate);
  }

  @Override
  public Set<String> findGrantedKeys(Collection<String> idempotencyKeys) {
    return idempotencyKeys.stream()
        .filter(key -> appliedGrants.getIfPresent(key) != null)
        .collect(Collectors.toSet());
  }

  @Override
  public Map<String, BigDecimal> findGrantedTotals(UUID scheduleId, Collection<String> userIds) {
    var totals = new HashMap<String, BigDecimal>();
    for (var userId : userIds) {
      var total = scheduleTotals.getIfPresent(totalKey(scheduleId.toString(), userId));
      if (total != null) {
        totals.put(userId, total);
      }
    }
    return totals;
  }

  private static String totalKey(String scheduleId, String userId) {
    return scheduleId + ":" + userId;
  }
}
