package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;

@Entity
@Table(name = "ingredient_batches", indexes = {
        @Index(name = "idx_batch_ingredient_location", columnList = "ingredient_id, location"),
        @Index(name = "idx_batch_expiry", columnList = "expiry_date")
})
@Data
public class IngredientBatch {

    /**
     * Consumption order: soonest expiry first, batches without expiry last,
     * then oldest first. Id breaks remaining ties so the order is total.
     */
    public static final Comparator<IngredientBatch> FIFO_ORDER = Comparator
            .comparing(IngredientBatch::getExpiryDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(IngredientBatch::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(IngredientBatch::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 20)
    private String batchNumber; // e.g. B-20260105-001

    @ManyToOne(optional = false)
    @JoinColumn(name = "ingredient_id", nullable = false)
    private Ingredient ingredient;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal initialQuantity;

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal remainingQuantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private StockLocation location;

    private boolean active = true;

    private String notes;

    // set by the ledger from its clock; second key of the FIFO order
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (remainingQuantity == null) {
            remainingQuantity = initialQuantity;
        }
    }

    /**
     * Takes up to {@code requested} from this batch and retires it when empty.
     *
     * @return the quantity actually taken
     */
    public BigDecimal draw(BigDecimal requested) {
        BigDecimal taken = requested.min(remainingQuantity);
        remainingQuantity = remainingQuantity.subtract(taken);
        if (remainingQuantity.signum() == 0) {
            active = false;
        }
        return taken;
    }
}
