package com.checkmate.pos_sync.line;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface LineLogRepository extends JpaRepository<LineLogEntity, Long> {

    Optional<LineLogEntity> findByMealTypeAndLineNumAndLineDate(String mealType, int lineNum, LocalDate lineDate);

    /**
     * Creates the day's log unless another station already did.
     */
    @Modifying
    @Query(value = """
        INSERT INTO line_logs (meal_type, line_num, line_date, created_at)
        VALUES (:mealType, :lineNum, :lineDate, CURRENT_TIMESTAMP)
        ON CONFLICT ON CONSTRAINT uq_line_logs_line_day DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("mealType") String mealType,
                       @Param("lineNum") int lineNum,
                       @Param("lineDate") LocalDate lineDate);
}
