package com.gastro.ledger.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
public class VariantRequest {

    @NotBlank(message = "Product name is required")
    private String productName;

    private String variantName;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Price must be greater than 0")
    private BigDecimal price;

    @Valid
    private List<RecipeLineRequest> recipe = new ArrayList<>();

    @Data
    public static class RecipeLineRequest {
        @NotNull(message = "Ingredient ID is required")
        private Long ingredientId;

        @NotNull(message = "Quantity per unit is required")
        private BigDecimal quantityPerUnit;

        private boolean primary;
    }
}
