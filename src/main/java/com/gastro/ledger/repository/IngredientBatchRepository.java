package com.gastro.ledger.repository;

import com.gastro.ledger.model.IngredientBatch;
import com.gastro.ledger.model.StockLocation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface IngredientBatchRepository extends JpaRepository<IngredientBatch, Long> {

    /**
     * Batches a consumption may draw from, locked for the rest of the
     * transaction (lock timeout comes from
     * {@code jakarta.persistence.lock.timeout}). Callers sort them with {@link IngredientBatch#FIFO_ORDER}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM IngredientBatch b WHERE b.ingredient.id = :ingredientId AND b.location = :location "
            + "AND b.active = true AND b.remainingQuantity > 0 ORDER BY b.id")
    List<IngredientBatch> findEligibleForUpdate(@Param("ingredientId") Long ingredientId,
            @Param("location") StockLocation location);

    @Query("SELECT b FROM IngredientBatch b WHERE b.ingredient.id = :ingredientId "
            + "AND (:location IS NULL OR b.location = :location) "
            + "AND (:activeOnly = false OR (b.active = true AND b.remainingQuantity > 0))")
    List<IngredientBatch> findForIngredient(@Param("ingredientId") Long ingredientId,
            @Param("location") StockLocation location, @Param("activeOnly") boolean activeOnly);

    @Query("SELECT b FROM IngredientBatch b JOIN FETCH b.ingredient WHERE b.active = true "
            + "AND b.remainingQuantity > 0 AND b.expiryDate IS NOT NULL")
    List<IngredientBatch> findActiveWithExpiry();

    @Query("SELECT b.batchNumber FROM IngredientBatch b WHERE b.batchNumber LIKE CONCAT(:prefix, '%')")
    List<String> findBatchNumbersStartingWith(@Param("prefix") String prefix);

    boolean existsByIngredientId(Long ingredientId);
}
