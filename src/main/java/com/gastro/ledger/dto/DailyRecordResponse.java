package com.gastro.ledger.dto;

import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.DayStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record DailyRecordResponse(
        Long id,
        LocalDate date,
        DayStatus status,
        LocalDateTime openedAt,
        LocalDateTime closedAt,
        String notes,
        List<SnapshotLine> snapshots) {

    public static DailyRecordResponse from(DailyRecord record, List<SnapshotLine> snapshots) {
        return new DailyRecordResponse(record.getId(), record.getDate(), record.getStatus(), record.getOpenedAt(),
                record.getClosedAt(), record.getNotes(), snapshots);
    }
}
