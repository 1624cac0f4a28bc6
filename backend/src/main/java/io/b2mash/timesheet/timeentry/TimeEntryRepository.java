package io.b2mash.timesheet.timeentry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, Long> {

  Optional<TimeEntry> findByIdAndUserId(Long id, Long userId);

  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.userId = :userId
        AND te.entryDate >= :from
        AND te.entryDate <= :to
      ORDER BY te.entryDate ASC, te.startTime ASC
      """)
  List<TimeEntry> findByUserIdAndDateBetween(
      @Param("userId") Long userId, @Param("from") LocalDate from, @Param("to") LocalDate to);
}
