package com.gastro.ledger.dto;

import com.gastro.ledger.model.Ingredient;
import com.gastro.ledger.model.UnitType;

public record IngredientResponse(Long id, String name, UnitType unitType, String unitLabel, boolean active) {

    public static IngredientResponse from(Ingredient ingredient) {
        return new IngredientResponse(ingredient.getId(), ingredient.getName(), ingredient.getUnitType(),
                ingredient.getUnitLabel(), ingredient.isActive());
    }
}
