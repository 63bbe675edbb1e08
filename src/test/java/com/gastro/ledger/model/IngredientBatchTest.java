package com.gastro.ledger.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IngredientBatchTest {

    private static IngredientBatch batch(long id, LocalDate expiry, LocalDateTime createdAt, String remaining) {
        IngredientBatch batch = new IngredientBatch();
        batch.setId(id);
        batch.setExpiryDate(expiry);
        batch.setCreatedAt(createdAt);
        batch.setInitialQuantity(new BigDecimal(remaining));
        batch.setRemainingQuantity(new BigDecimal(remaining));
        return batch;
    }

    @Test
    void fifoOrder_soonestExpiryFirstAndNoExpiryLast() {
        LocalDateTime t = LocalDateTime.of(2026, 1, 5, 8, 0);
        IngredientBatch noExpiry = batch(1, null, t.minusDays(3), "1");
        IngredientBatch late = batch(2, LocalDate.of(2026, 1, 20), t.minusDays(2), "1");
        IngredientBatch early = batch(3, LocalDate.of(2026, 1, 10), t, "1");

        List<IngredientBatch> batches = new ArrayList<>(List.of(noExpiry, late, early));
        batches.sort(IngredientBatch.FIFO_ORDER);

        assertEquals(List.of(early, late, noExpiry), batches);
    }

    @Test
    void fifoOrder_sameExpiryFallsBackToCreationThenId() {
        LocalDate expiry = LocalDate.of(2026, 1, 10);
        LocalDateTime t = LocalDateTime.of(2026, 1, 5, 8, 0);
        IngredientBatch newer = batch(1, expiry, t.plusHours(1), "1");
        IngredientBatch olderHighId = batch(3, expiry, t, "1");
        IngredientBatch olderLowId = batch(2, expiry, t, "1");

        List<IngredientBatch> batches = new ArrayList<>(List.of(newer, olderHighId, olderLowId));
        batches.sort(IngredientBatch.FIFO_ORDER);

        assertEquals(List.of(olderLowId, olderHighId, newer), batches);
    }

    @Test
    void draw_takesAtMostRemainingAndRetiresEmptyBatch() {
        IngredientBatch batch = batch(1, null, null, "2.000");

        assertEquals(new BigDecimal("0.500"), batch.draw(new BigDecimal("0.500")));
        assertTrue(batch.isActive());

        assertEquals(0, new BigDecimal("1.5").compareTo(batch.draw(new BigDecimal("4"))));
        assertEquals(0, batch.getRemainingQuantity().signum());
        assertFalse(batch.isActive());
    }
}
