package io.b2mash.credits.user;

import java.time.Instant;

/**
 * A page request against the user store. Null bounds are not applied. Results are ordered by the
 * text form of the user id; {@code afterUserId} is the exclusive keyset cursor.
 *
 * @param registeredFrom inclusive lower bound on registration time
 * @param registeredUntil inclusive upper bound on registration time
 * @param activeSince inclusive lower bound on last activity time
 * @param segment name of a configured SQL segment to AND into the filter
 * @param afterUserId keyset cursor, exclusive
 * @param limit page size
 */
public record CohortQuery(
    Instant registeredFrom,
    Instant registeredUntil,
    Instant activeSince,
    String segment,
    String afterUserId,
    int limit) {

  public static CohortQuery all() {
    return new CohortQuery(null, null, null, null, null, 0);
  }

  public CohortQuery page(String after, int pageSize) {
    return new CohortQuery(registeredFrom, registeredUntil, activeSince, segment, after, pageSize);
  }
}
