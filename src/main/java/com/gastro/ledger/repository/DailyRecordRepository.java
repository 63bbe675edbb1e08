package com.gastro.ledger.repository;

import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.DayStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;

public interface DailyRecordRepository extends JpaRepository<DailyRecord, Long> {

    Optional<DailyRecord> findFirstByStatus(DayStatus status);

    boolean existsByDate(LocalDate date);

    // Close takes this lock; sales and voids wait on it and then see CLOSED.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DailyRecord d WHERE d.id = :id")
    Optional<DailyRecord> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT d FROM DailyRecord d WHERE d.id = :id")
    Optional<DailyRecord> findByIdForShare(@Param("id") Long id);

    // Stock movements attach to the day found here; a row closed meanwhile no longer matches.
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT d FROM DailyRecord d WHERE d.status = :status")
    Optional<DailyRecord> findByStatusForShare(@Param("status") DayStatus status);
}
