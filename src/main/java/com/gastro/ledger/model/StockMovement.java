package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One ledger event. The day it belongs to is the day that was open when it
 * was logged; movements logged while no day is open carry no day.
 */
@Entity
@Table(name = "stock_movements", indexes = {
        @Index(name = "idx_movement_day", columnList = "daily_record_id")
})
@Data
public class StockMovement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "ingredient_id", nullable = false)
    private Ingredient ingredient;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MovementType movementType;

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal quantity;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private StockLocation fromLocation; // null for deliveries

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private StockLocation toLocation; // null for spoilage and sales

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private SpoilageReason spoilageReason;

    private String notes;

    @ManyToOne
    @JoinColumn(name = "daily_record_id")
    private DailyRecord dailyRecord;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
