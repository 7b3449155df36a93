package io.b2mash.credits.schedule;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditScheduleRepository extends JpaRepository<CreditSchedule, UUID> {

  Optional<CreditSchedule> findByIdAndDeletedFalse(UUID id);

  Page<CreditSchedule> findByDeletedFalse(Pageable pageable);

  Page<CreditSchedule> findByDeletedFalseAndActive(boolean active, Pageable pageable);

  List<CreditSchedule> findByActiveTrueAndDeletedFalse();

  List<CreditSchedule> findByDeletedFalseOrderByTotalCreditsDistributedDesc(Pageable pageable);

  long countByDeletedFalse();

  long countByActiveTrueAndDeletedFalse();

  @Query(
      "SELECT COALESCE(SUM(s.totalCreditsDistributed), 0) FROM CreditSchedule s"
          + " WHERE s.deleted = false")
  BigDecimal sumCreditsDistributed();

  @Query(
      "SELECT COALESCE(SUM(s.totalUsersCredited), 0) FROM CreditSchedule s"
          + " WHERE s.deleted = false")
  long sumUsersCredited();

  @Query("SELECT COALESCE(SUM(s.totalExecutions), 0) FROM CreditSchedule s WHERE s.deleted = false")
  long sumExecutions();

  /**
   * Adds one finished firing to the schedule's running counters in a single UPDATE, so concurrent
   * firings and admin edits never lose increments.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE CreditSchedule s
      SET s.totalCreditsDistributed = s.totalCreditsDistributed + :credits,
          s.totalUsersCredited = s.totalUsersCredited + :users,
          s.totalExecutions = s.totalExecutions + 1,
          s.lastFiredAt = :firedAt
      WHERE s.id = :id
      """)
  int recordFiring(
      @Param("id") UUID id,
      @Param("credits") BigDecimal credits,
      @Param("users") long users,
      @Param("firedAt") Instant firedAt);

  /** Adds grants that were made after their firing was already counted. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE CreditSchedule s
      SET s.totalCreditsDistributed = s.totalCreditsDistributed + :credits,
          s.totalUsersCredited = s.totalUsersCredited + :users
      WHERE s.id = :id
      """)
  int addLateGrants(
      @Param("id") UUID id, @Param("credits") BigDecimal credits, @Param("users") long users);
}
