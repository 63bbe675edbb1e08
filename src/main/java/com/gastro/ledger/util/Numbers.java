package com.gastro.ledger.util;

import java.math.BigDecimal;

/**
 * Helpers for aggregate query results, whose numeric type depends on the
 * database dialect (Long, Double or BigDecimal).
 */
public final class Numbers {

    private Numbers() {
    }

    public static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString());
    }

    public static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    public static BigDecimal zeroIfNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
