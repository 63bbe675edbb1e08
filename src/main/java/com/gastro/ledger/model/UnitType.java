package com.gastro.ledger.model;

import com.gastro.ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How an ingredient is measured. Every quantity check and every rounding of a
 * derived quantity goes through the ingredient's unit type.
 */
public enum UnitType {
    WEIGHT(3, 2),
    COUNT(0, 0);

    /** Scale used for stored quantities (batches, snapshots, movements). */
    public static final int STORAGE_SCALE = 3;

    private final int maxInputScale;
    private final int impliedScale;

    UnitType(int maxInputScale, int impliedScale) {
        this.maxInputScale = maxInputScale;
        this.impliedScale = impliedScale;
    }

    public BigDecimal requirePositive(BigDecimal quantity, String label) {
        BigDecimal checked = checkPrecision(quantity, label);
        if (checked.signum() <= 0) {
            throw new ValidationException(label + " must be greater than zero");
        }
        return checked;
    }

    public BigDecimal requireNonNegative(BigDecimal quantity, String label) {
        BigDecimal checked = checkPrecision(quantity, label);
        if (checked.signum() < 0) {
            throw new ValidationException(label + " cannot be negative");
        }
        return checked;
    }

    /**
     * Rounds a quantity inferred from usage to the unit's natural granularity.
     * Partial units always round up.
     */
    public BigDecimal roundImplied(BigDecimal raw) {
        return raw.setScale(impliedScale, RoundingMode.CEILING);
    }

    public int getImpliedScale() {
        return impliedScale;
    }

    private BigDecimal checkPrecision(BigDecimal quantity, String label) {
        if (quantity == null) {
            throw new ValidationException(label + " is required");
        }
        BigDecimal stripped = quantity.stripTrailingZeros();
        if (stripped.scale() > maxInputScale) {
            if (this == COUNT) {
                throw new ValidationException(label + " must be a whole number for count-based ingredients");
            }
            throw new ValidationException(label + " allows at most " + maxInputScale + " decimal places");
        }
        return quantity.setScale(STORAGE_SCALE, RoundingMode.UNNECESSARY);
    }
}
