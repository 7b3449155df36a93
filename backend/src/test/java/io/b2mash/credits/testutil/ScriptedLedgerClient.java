package io.b2mash.credits.testutil;

import io.b2mash.credits.ledger.CreditLedgerClient;
import io.b2mash.credits.ledger.GrantReceipt;
import io.b2mash.credits.ledger.GrantRequest;
import io.b2mash.credits.ledger.LedgerGrantException;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Ledger whose failures are scripted per user: permanent rejections, or a number of transient
 * failures before the grant succeeds.
 */
public class ScriptedLedgerClient implements CreditLedgerClient {

  private final Set<String> rejectedUsers = ConcurrentHashMap.newKeySet();
  private final Map<String, AtomicInteger> transientFailures = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
  private final Map<String, GrantRequest> applied = new ConcurrentHashMap<>();
  private final Set<String> hiddenFromLookup = ConcurrentHashMap.newKeySet();

  public ScriptedLedgerClient reject(String... userIds) {
    rejectedUsers.addAll(Set.of(userIds));
    return this;
  }

  public ScriptedLedgerClient failTransiently(String userId, int times) {
    transientFailures.put(userId, new AtomicInteger(times));
    return this;
  }

  /** Marks a grant as already applied, as if a previous run had made it. */
  public ScriptedLedgerClient preApplied(GrantRequest request) {
    applied.put(request.idempotencyKey(), request);
    return this;
  }

  /**
   * Marks a grant as applied but not yet visible to {@link #findGrantedKeys}, so a new attempt
   * reaches {@link #grant} and gets a duplicate receipt.
   */
  public ScriptedLedgerClient appliedButNotVisible(GrantRequest request) {
    applied.put(request.idempotencyKey(), request);
    hiddenFromLookup.add(request.idempotencyKey());
    return this;
  }

  @Override
  public String providerId() {
    return "scripted";
  }

  @Override
  public GrantReceipt grant(GrantRequest request) {
    attempts.computeIfAbsent(request.userId(), id -> new AtomicInteger()).incrementAndGet();
    if (rejectedUsers.contains(request.userId())) {
      throw new LedgerGrantException("User " + request.userId() + " is blocked", false);
    }
    var remaining = transientFailures.get(request.userId());
    if (remaining != null && remaining.getAndDecrement() > 0) {
      throw new LedgerGrantException("Ledger unavailable", true);
    }
    boolean duplicate = applied.putIfAbsent(request.idempotencyKey(), request) != null;
    return new GrantReceipt("G-" + request.idempotencyKey(), duplicate);
  }

  @Override
  public Set<String> findGrantedKeys(Collection<String> idempotencyKeys) {
    return idempotencyKeys.stream()
        .filter(key -> applied.containsKey(key) && !hiddenFromLookup.contains(key))
        .collect(Collectors.toSet());
  }

  @Override
  public Map<String, BigDecimal> findGrantedTotals(UUID scheduleId, Collection<String> userIds) {
    var totals = new HashMap<String, BigDecimal>();
    for (var grant : applied.values()) {
      if (grant.scheduleId().equals(scheduleId.toString()) && userIds.contains(grant.userId())) {
        totals.merge(grant.userId(), grant.amount(), BigDecimal::add);
      }
    }
    return totals;
  }

  public int attempts(String userId) {
    var count = attempts.get(userId);
    return count == null ? 0 : count.get();
  }

  public int appliedCount() {
    return applied.size();
  }

  public Collection<GrantRequest> appliedGrants() {
    return applied.values();
  }
}
