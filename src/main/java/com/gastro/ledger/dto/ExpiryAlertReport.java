package com.gastro.ledger.dto;

import java.util.List;

public record ExpiryAlertReport(
        List<ExpiryAlert> alerts,
        int total,
        int expiredCount,
        int criticalCount,
        int warningCount) {
}
