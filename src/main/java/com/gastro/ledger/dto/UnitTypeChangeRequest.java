package com.gastro.ledger.dto;

import com.gastro.ledger.model.UnitType;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UnitTypeChangeRequest {

    @NotNull(message = "Unit type is required")
    private UnitType unitType;
}
