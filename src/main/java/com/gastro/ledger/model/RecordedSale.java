package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A point-of-sale tap. Immutable apart from the void fields, which are set
 * once and never cleared.
 */
@Entity
@Table(name = "recorded_sales", indexes = {
        @Index(name = "idx_recorded_sales_day", columnList = "daily_record_id"),
        @Index(name = "idx_recorded_sales_variant", columnList = "product_variant_id")
})
@Data
public class RecordedSale {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "daily_record_id", nullable = false, updatable = false)
    private DailyRecord dailyRecord;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_variant_id", nullable = false, updatable = false)
    private ProductVariant productVariant;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    private Long shiftId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    private LocalDateTime voidedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private VoidReason voidReason;

    @Column(length = 255)
    private String voidNotes;

    public boolean isVoided() {
        return voidedAt != null;
    }

    public BigDecimal getTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
