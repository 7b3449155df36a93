package io.b2mash.credits.ledger;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Port to the credit ledger service. Implementations must be safe for concurrent use; the batch
 * executor calls {@link #grant} from several worker threads at once.
 */
public interface CreditLedgerClient {

  String providerId();

  /**
   * Applies a grant. Repeating a grant with the same idempotency key must not credit the user
   * twice.
   *
   * @throws LedgerGrantException if the ledger did not apply the grant
   */
  GrantReceipt grant(GrantRequest request);

  /** Returns the subset of the given idempotency keys the ledger has already applied. */
  Set<String> findGrantedKeys(Collection<String> idempotencyKeys);

  /**
   * Sums, per user, the amounts granted under the given schedule's idempotency keys across all
   * periods. Users with no grant may be absent from the result.
   */
  Map<String, BigDecimal> findGrantedTotals(UUID scheduleId, Collection<String> userIds);
}
