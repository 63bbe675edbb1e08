package com.gastro.ledger.dto;

import com.gastro.ledger.model.ProductVariant;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

public record VariantResponse(
        Long id,
        Long productId,
        String productName,
        String variantName,
        BigDecimal price,
        boolean active,
        List<RecipeLineView> recipe) {

    public record RecipeLineView(Long ingredientId, String ingredientName, BigDecimal quantityPerUnit,
            boolean primary) {
    }

    public static VariantResponse from(ProductVariant variant) {
        List<RecipeLineView> lines = variant.getRecipeLines().stream()
                .map(l -> new RecipeLineView(l.getIngredient().getId(), l.getIngredient().getName(),
                        l.getQuantityPerUnit(), l.isPrimary()))
                .collect(Collectors.toList());
        return new VariantResponse(variant.getId(), variant.getProduct().getId(), variant.getProduct().getName(),
                variant.getName(), variant.getPrice(), variant.isActive(), lines);
    }
}
