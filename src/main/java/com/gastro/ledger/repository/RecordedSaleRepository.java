package com.gastro.ledger.repository;

import com.gastro.ledger.model.RecordedSale;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RecordedSaleRepository extends JpaRepository<RecordedSale, Long> {

    // Concurrent voids of the same sale serialize here
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT rs FROM RecordedSale rs WHERE rs.id = :id")
    Optional<RecordedSale> findByIdForUpdate(@Param("id") Long id);

    List<RecordedSale> findByDailyRecordIdOrderByRecordedAtDescIdDesc(Long dailyRecordId);

    List<RecordedSale> findByDailyRecordIdAndVoidedAtIsNullOrderByRecordedAtDescIdDesc(Long dailyRecordId);

    // Returns [ingredientId, expectedUsage]; every recipe line counts, not only the primary one
    @Query("SELECT rl.ingredient.id, SUM(rs.quantity * rl.quantityPerUnit) FROM RecordedSale rs "
            + "JOIN rs.productVariant v JOIN v.recipeLines rl "
            + "WHERE rs.dailyRecord.id = :dailyRecordId AND rs.voidedAt IS NULL "
            + "GROUP BY rl.ingredient.id")
    List<Object[]> sumExpectedUsageByIngredient(@Param("dailyRecordId") Long dailyRecordId);

    // Returns [variantId, totalQuantity, totalRevenue]
    @Query("SELECT rs.productVariant.id, SUM(rs.quantity), SUM(rs.quantity * rs.unitPrice) FROM RecordedSale rs "
            + "WHERE rs.dailyRecord.id = :dailyRecordId AND rs.voidedAt IS NULL "
            + "GROUP BY rs.productVariant.id")
    List<Object[]> sumRecordedByVariant(@Param("dailyRecordId") Long dailyRecordId);

    // Returns a single row [salesCount, itemsCount, totalRevenue]
    @Query("SELECT COUNT(rs), COALESCE(SUM(rs.quantity), 0), COALESCE(SUM(rs.quantity * rs.unitPrice), 0) "
            + "FROM RecordedSale rs WHERE rs.dailyRecord.id = :dailyRecordId AND rs.voidedAt IS NULL")
    List<Object[]> sumDayTotals(@Param("dailyRecordId") Long dailyRecordId);
}
