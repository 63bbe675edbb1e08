package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "daily_records")
@Data
public class DailyRecord {

    static final String OPEN_MARKER = "OPEN";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_date", unique = true, nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DayStatus status;

    // Unique while set: the database admits a single open day. Cleared on close.
    @Column(unique = true, length = 4)
    private String openMarker;

    private LocalDateTime openedAt;

    private LocalDateTime closedAt;

    @Column(length = 1000)
    private String notes;

    public boolean isOpen() {
        return status == DayStatus.OPEN;
    }

    public void markOpen(LocalDateTime at) {
        status = DayStatus.OPEN;
        openMarker = OPEN_MARKER;
        openedAt = at;
    }

    public void markClosed(LocalDateTime at) {
        status = DayStatus.CLOSED;
        openMarker = null;
        closedAt = at;
    }
}
