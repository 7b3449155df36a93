package io.b2mash.credits.eligibility;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Supplies the cohort of a CUSTOM-targeted schedule whose {@code customCriteria} equals {@link
 * #name()}. Register implementations as Spring beans. Pages must be ordered by user id and use the
 * last id of a page as the next page token.
 */
public interface CustomCohortSource {

  String name();

  CohortPage page(String afterUserId, int pageSize, Instant now);

  default OptionalLong estimateSize(Instant now) {
    return OptionalLong.empty();
  }
}
