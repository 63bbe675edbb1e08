package com.gastro.ledger.dto;

import java.util.List;

public record ClosingResult(
        DailyRecordResponse day,
        List<UsageItem> usage,
        List<DiscrepancyAlert> alerts) {
}
