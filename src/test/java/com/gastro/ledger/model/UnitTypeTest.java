package com.gastro.ledger.model;

import com.gastro.ledger.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class UnitTypeTest {

    @Test
    void requirePositive_weightKeepsThreeDecimals() {
        BigDecimal checked = UnitType.WEIGHT.requirePositive(new BigDecimal("2.125"), "Quantity");
        assertEquals(new BigDecimal("2.125"), checked);
        assertEquals(UnitType.STORAGE_SCALE, checked.scale());
    }

    @Test
    void requirePositive_weightRejectsFourDecimals() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> UnitType.WEIGHT.requirePositive(new BigDecimal("0.1234"), "Quantity"));
        assertTrue(ex.getMessage().contains("decimal places"));
    }

    @Test
    void requirePositive_countRejectsFraction() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> UnitType.COUNT.requirePositive(new BigDecimal("2.5"), "Quantity"));
        assertTrue(ex.getMessage().contains("whole number"));
    }

    @Test
    void requirePositive_countAcceptsTrailingZeros() {
        assertEquals(0, new BigDecimal("3").compareTo(UnitType.COUNT.requirePositive(new BigDecimal("3.000"), "Qty")));
    }

    @Test
    void requirePositive_rejectsZeroNegativeAndNull() {
        assertThrows(ValidationException.class, () -> UnitType.WEIGHT.requirePositive(BigDecimal.ZERO, "Qty"));
        assertThrows(ValidationException.class, () -> UnitType.WEIGHT.requirePositive(new BigDecimal("-1"), "Qty"));
        assertThrows(ValidationException.class, () -> UnitType.COUNT.requirePositive(null, "Qty"));
    }

    @Test
    void requireNonNegative_acceptsZero() {
        assertEquals(0, BigDecimal.ZERO.compareTo(UnitType.COUNT.requireNonNegative(BigDecimal.ZERO, "Count")));
        assertThrows(ValidationException.class,
                () -> UnitType.COUNT.requireNonNegative(new BigDecimal("-1"), "Count"));
    }

    @Test
    void roundImplied_countRoundsUpToWholeUnits() {
        assertEquals(new BigDecimal("11"), UnitType.COUNT.roundImplied(new BigDecimal("10.01")));
        assertEquals(new BigDecimal("10"), UnitType.COUNT.roundImplied(new BigDecimal("10.000")));
    }

    @Test
    void roundImplied_weightRoundsUpToTwoDecimals() {
        assertEquals(new BigDecimal("1.24"), UnitType.WEIGHT.roundImplied(new BigDecimal("1.231")));
        assertEquals(new BigDecimal("1.23"), UnitType.WEIGHT.roundImplied(new BigDecimal("1.230")));
    }
}
