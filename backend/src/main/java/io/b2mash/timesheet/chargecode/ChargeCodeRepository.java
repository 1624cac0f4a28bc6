package io.b2mash.timesheet.chargecode;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChargeCodeRepository extends JpaRepository<ChargeCode, Long> {

  @Query(
      """
      SELECT cc FROM ChargeCode cc
      WHERE cc.userId = :userId
      ORDER BY cc.projectNumber ASC, cc.taskNumber ASC
      """)
  List<ChargeCode> findByUserIdOrdered(@Param("userId") Long userId);

  Optional<ChargeCode> findByIdAndUserId(Long id, Long userId);

  boolean existsByIdAndUserId(Long id, Long userId);

  boolean existsByUserIdAndProjectNumberAndTaskNumber(
      Long userId, String projectNumber, String taskNumber);
}
