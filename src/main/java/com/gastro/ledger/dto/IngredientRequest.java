package com.gastro.ledger.dto;

import com.gastro.ledger.model.UnitType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class IngredientRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Unit type is required")
    private UnitType unitType;

    @Size(max = 20, message = "Unit label cannot exceed 20 characters")
    private String unitLabel;
}
