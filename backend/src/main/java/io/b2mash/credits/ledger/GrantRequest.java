package io.b2mash.credits.ledger;

import java.math.BigDecimal;

public record GrantRequest(
    String userId, BigDecimal amount, String reason, String idempotencyKey) {

  /** Idempotency key of a scheduled grant: {@code scheduleId:periodKey:userId}. */
  public static String idempotencyKey(Object scheduleId, String periodKey, String userId) {
    return scheduleId + ":" + periodKey + ":" + userId;
  }

  /** The schedule id at the front of this grant's idempotency key. */
  public String scheduleId() {
    int separator = idempotencyKey.indexOf(':');
    return separator < 0 ? idempotencyKey : idempotencyKey.substring(0, separator);
  }
}
