package io.b2mash.credits.eligibility;

import java.util.List;

/**
 * One page of eligible user ids. {@code nextPageToken} is null on the last page. A page may be
 * empty while more pages follow, when every candidate on it was already credited.
 */
public record CohortPage(List<String> userIds, String nextPageToken) {

  public CohortPage {
    userIds = List.copyOf(userIds);
  }

  public static CohortPage last(List<String> userIds) {
    return new CohortPage(userIds, null);
  }

  public boolean hasMore() {
    return nextPageToken != null;
  }
}
