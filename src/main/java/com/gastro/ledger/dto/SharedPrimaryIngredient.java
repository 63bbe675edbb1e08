package com.gastro.ledger.dto;

import java.util.List;

/** An ingredient left out of calculated sales because several active variants use it as primary. */
public record SharedPrimaryIngredient(Long ingredientId, String ingredientName, List<Long> variantIds) {
}
