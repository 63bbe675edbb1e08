package com.gastro.ledger.repository;

import com.gastro.ledger.model.BatchDeduction;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface BatchDeductionRepository extends JpaRepository<BatchDeduction, Long> {
    List<BatchDeduction> findByBatchIdOrderByCreatedAtAsc(Long batchId);

    List<BatchDeduction> findByMovementId(Long movementId);
}
