package com.gastro.ledger.dto;

import java.math.BigDecimal;

public record DayTotals(Long dailyRecordId, BigDecimal totalRevenue, long salesCount, long itemsCount) {
}
