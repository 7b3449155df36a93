package io.b2mash.credits.eligibility;

import io.b2mash.credits.ledger.CreditLedgerClient;
import io.b2mash.credits.ledger.GrantRequest;
import io.b2mash.credits.schedule.CreditSchedule;
import io.b2mash.credits.schedule.Targeting;
import io.b2mash.credits.user.CohortQuery;
import io.b2mash.credits.user.UserDirectory;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a schedule's targeting into pages of user ids, leaving out users the ledger has already
 * credited for the same schedule and period, and users who already hold the schedule's
 * per-user maximum.
 */
@Component
public class EligibilityEvaluator {

  private static final Logger log = LoggerFactory.getLogger(EligibilityEvaluator.class);

  private final UserDirectory userDirectory;
  private final CreditLedgerClient ledgerClient;
  private final Map<String, CustomCohortSource> customSources;

  public EligibilityEvaluator(
      UserDirectory userDirectory,
      CreditLedgerClient ledgerClient,
      List<CustomCohortSource> customSources) {
    this.userDirectory = userDirectory;
    this.ledgerClient = ledgerClient;
    this.customSources =
        customSources.stream()
            .collect(Collectors.toMap(CustomCohortSource::name, Function.identity()));
  }

  public CohortPage cohort(
      CreditSchedule schedule, String periodKey, String pageToken, int pageSize, Instant now) {
    var candidates = candidates(schedule.targeting(), pageToken, pageSize, now);
    if (candidates.userIds().isEmpty()) {
      return candidates;
    }
    var eligible = withoutCreditedInPeriod(schedule, periodKey, candidates.userIds());
    eligible = withoutUsersAtLimit(schedule, eligible);
    if (eligible.size() == candidates.userIds().size()) {
      return candidates;
    }
    return new CohortPage(eligible, candidates.nextPageToken());
  }

  private List<String> withoutCreditedInPeriod(
      CreditSchedule schedule, String periodKey, List<String> userIds) {
    var keysByUser = new LinkedHashMap<String, String>();
    for (var userId : userIds) {
      keysByUser.put(userId, GrantRequest.idempotencyKey(schedule.getId(), periodKey, userId));
    }
    var granted = ledgerClient.findGrantedKeys(keysByUser.values());
    if (granted.isEmpty()) {
      return userIds;
    }
    var eligible =
        keysByUser.entrySet().stream()
            .filter(entry -> !granted.contains(entry.getValue()))
            .map(Map.Entry::getKey)
            .toList();
    log.debug(
        "Schedule {} period {}: {} of {} candidates already credited",
        schedule.getId(),
        periodKey,
        userIds.size() - eligible.size(),
        userIds.size());
    return eligible;
  }

  private List<String> withoutUsersAtLimit(CreditSchedule schedule, List<String> userIds) {
    var limit = schedule.getMaxCreditsPerUser();
    if (limit == null || userIds.isEmpty()) {
      return userIds;
    }
    var totals = ledgerClient.findGrantedTotals(schedule.getId(), userIds);
    var eligible =
        userIds.stream()
            .filter(
                userId -> {
                  var total = totals.get(userId);
                  return total == null || total.compareTo(limit) < 0;
                })
            .toList();
    if (eligible.size() < userIds.size()) {
      log.debug(
          "Schedule {}: {} of {} candidates already hold the per-user maximum of {}",
          schedule.getId(),
          userIds.size() - eligible.size(),
          userIds.size(),
          limit);
    }
    return eligible;
  }

  /** Size of the candidate population right now, without excluding already credited users. */
  public OptionalLong estimateCohortSize(CreditSchedule schedule, Instant now) {
    var targeting = schedule.targeting();
    if (targeting instanceof Targeting.Custom custom
        && customSources.containsKey(custom.criteria())) {
      return customSources.get(custom.criteria()).estimateSize(now);
    }
    return OptionalLong.of(userDirectory.countUsers(query(targeting, now)));
  }

  /** Whether CUSTOM targeting with this criteria name can be resolved. */
  public boolean isKnownCustomCriteria(String criteria) {
    return customSources.containsKey(criteria) || userDirectory.hasSegment(criteria);
  }

  private CohortPage candidates(
      Targeting targeting, String pageToken, int pageSize, Instant now) {
    if (targeting instanceof Targeting.Custom custom
        && customSources.containsKey(custom.criteria())) {
      return customSources.get(custom.criteria()).page(pageToken, pageSize, now);
    }
    var userIds = userDirectory.findUserIds(query(targeting, now).page(pageToken, pageSize));
    var next = userIds.size() == pageSize ? userIds.get(userIds.size() - 1) : null;
    return new CohortPage(userIds, next);
  }

  CohortQuery query(Targeting targeting, Instant now) {
    if (targeting instanceof Targeting.NewUsers newUsers) {
      var registeredFrom = now.minus(Duration.ofDays(newUsers.maxDaysSinceRegistration()));
      var registeredUntil =
          newUsers.minDaysSinceRegistration() == null
              ? null
              : now.minus(Duration.ofDays(newUsers.minDaysSinceRegistration()));
      return new CohortQuery(registeredFrom, registeredUntil, null, null, null, 0);
    }
    if (targeting instanceof Targeting.ActiveUsers activeUsers) {
      var activeSince = now.minus(Duration.ofDays(activeUsers.maxDaysSinceLastActivity()));
      return new CohortQuery(null, null, activeSince, null, null, 0);
    }
    if (targeting instanceof Targeting.Custom custom) {
      if (!userDirectory.hasSegment(custom.criteria())) {
        throw new IllegalStateException(
            "No custom cohort source or user segment named '" + custom.criteria() + "'");
      }
      return new CohortQuery(null, null, null, custom.criteria(), null, 0);
    }
    return CohortQuery.all();
  }
}
