package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "batch_deductions")
@Data
public class BatchDeduction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "batch_id", nullable = false)
    private IngredientBatch batch;

    @ManyToOne(optional = false)
    @JoinColumn(name = "movement_id", nullable = false)
    private StockMovement movement;

    @ManyToOne
    @JoinColumn(name = "daily_record_id")
    private DailyRecord dailyRecord;

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MovementType reason;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
