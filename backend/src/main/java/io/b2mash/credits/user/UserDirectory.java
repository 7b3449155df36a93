package io.b2mash.credits.user;

import java.util.List;

/** Read-only access to the host application's user store. */
public interface UserDirectory {

  List<String> findUserIds(CohortQuery query);

  long countUsers(CohortQuery query);

  boolean hasSegment(String segment);
}
