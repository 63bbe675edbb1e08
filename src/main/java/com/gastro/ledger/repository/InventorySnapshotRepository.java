package com.gastro.ledger.repository;

import com.gastro.ledger.model.InventorySnapshot;
import com.gastro.ledger.model.SnapshotType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InventorySnapshotRepository extends JpaRepository<InventorySnapshot, Long> {

    @Query("SELECT s FROM InventorySnapshot s JOIN FETCH s.ingredient "
            + "WHERE s.dailyRecord.id = :dailyRecordId AND s.snapshotType = :type ORDER BY s.ingredient.name")
    List<InventorySnapshot> findForDay(@Param("dailyRecordId") Long dailyRecordId,
            @Param("type") SnapshotType type);
}
