package com.gastro.ledger.repository;

import com.gastro.ledger.model.StockMovement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StockMovementRepository extends JpaRepository<StockMovement, Long> {

    // Returns [ingredientId, movementType, fromLocation, toLocation, totalQuantity]
    @Query("SELECT m.ingredient.id, m.movementType, m.fromLocation, m.toLocation, SUM(m.quantity) "
            + "FROM StockMovement m WHERE m.dailyRecord.id = :dailyRecordId "
            + "GROUP BY m.ingredient.id, m.movementType, m.fromLocation, m.toLocation")
    List<Object[]> sumFlowsByIngredient(@Param("dailyRecordId") Long dailyRecordId);
}
