package com.gastro.ledger.service;

import com.gastro.ledger.dto.IngredientRequest;
import com.gastro.ledger.dto.IngredientResponse;
import com.gastro.ledger.dto.VariantRequest;
import com.gastro.ledger.dto.VariantResponse;
import com.gastro.ledger.exception.ConflictException;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.exception.StateException;
import com.gastro.ledger.exception.ValidationException;
import com.gastro.ledger.model.Ingredient;
import com.gastro.ledger.model.Product;
import com.gastro.ledger.model.ProductVariant;
import com.gastro.ledger.model.RecipeLine;
import com.gastro.ledger.model.UnitType;
import com.gastro.ledger.repository.IngredientBatchRepository;
import com.gastro.ledger.repository.IngredientRepository;
import com.gastro.ledger.repository.ProductRepository;
import com.gastro.ledger.repository.ProductVariantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The catalog operations the ledger depends on: ingredients with their unit
 * type, and sellable variants with their recipes.
 */
@Slf4j
@Service
public class CatalogService {

    private final IngredientRepository ingredientRepository;
    private final IngredientBatchRepository batchRepository;
    private final ProductRepository productRepository;
    private final ProductVariantRepository variantRepository;
    private final AuditService auditService;

    public CatalogService(IngredientRepository ingredientRepository,
            IngredientBatchRepository batchRepository,
            ProductRepository productRepository,
            ProductVariantRepository variantRepository,
            AuditService auditService) {
        this.ingredientRepository = ingredientRepository;
        this.batchRepository = batchRepository;
        this.productRepository = productRepository;
        this.variantRepository = variantRepository;
        this.auditService = auditService;
    }

    @Transactional
    public IngredientResponse createIngredient(IngredientRequest request) {
        String name = request.getName().trim();
        if (ingredientRepository.findByName(name).isPresent()) {
            throw new ConflictException("Ingredient '" + name + "' already exists");
        }
        Ingredient ingredient = new Ingredient();
        ingredient.setName(name);
        ingredient.setUnitType(request.getUnitType());
        if (request.getUnitLabel() != null && !request.getUnitLabel().isBlank()) {
            ingredient.setUnitLabel(request.getUnitLabel().trim());
        } else if (request.getUnitType() == UnitType.WEIGHT) {
            ingredient.setUnitLabel("kg");
        }
        ingredient = ingredientRepository.save(ingredient);
        log.info("Created ingredient {} ({}, {})", ingredient.getName(), ingredient.getUnitType(),
                ingredient.getUnitLabel());
        return IngredientResponse.from(ingredient);
    }

    /**
     * Unit type decides how stored quantities are read, so it is fixed once
     * the ingredient has any batch.
     */
    @Transactional
    public IngredientResponse changeUnitType(Long ingredientId, UnitType unitType) {
        Ingredient ingredient = ingredientRepository.findById(ingredientId)
                .orElseThrow(() -> new NotFoundException("Ingredient", ingredientId));
        if (ingredient.getUnitType() == unitType) {
            return IngredientResponse.from(ingredient);
        }
        if (batchRepository.existsByIngredientId(ingredientId)) {
            throw new StateException("Unit type of " + ingredient.getName() + " cannot change once batches exist",
                    StateException.UNIT_TYPE_LOCKED);
        }
        UnitType previous = ingredient.getUnitType();
        ingredient.setUnitType(unitType);
        ingredient = ingredientRepository.save(ingredient);
        auditService.log("CHANGE_UNIT_TYPE", ingredient.getName() + ": " + previous + " -> " + unitType);
        return IngredientResponse.from(ingredient);
    }

    @Transactional(readOnly = true)
    public List<IngredientResponse> listIngredients() {
        return ingredientRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(IngredientResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public VariantResponse createVariant(VariantRequest request) {
        String productName = request.getProductName().trim();
        Product product = productRepository.findByName(productName).orElseGet(() -> {
            Product created = new Product();
            created.setName(productName);
            return productRepository.save(created);
        });

        ProductVariant variant = new ProductVariant();
        variant.setProduct(product);
        variant.setName(request.getVariantName() != null && !request.getVariantName().isBlank()
                ? request.getVariantName().trim()
                : null);
        variant.setPrice(request.getPrice());

        Set<Long> seen = new HashSet<>();
        boolean hasPrimary = false;
        for (VariantRequest.RecipeLineRequest lineRequest : request.getRecipe()) {
            Ingredient ingredient = ingredientRepository.findById(lineRequest.getIngredientId())
                    .orElseThrow(() -> new NotFoundException("Ingredient", lineRequest.getIngredientId()));
            if (!seen.add(ingredient.getId())) {
                throw new ValidationException(ingredient.getName() + " appears twice in the recipe");
            }
            if (lineRequest.isPrimary()) {
                if (hasPrimary) {
                    throw new ValidationException("A recipe can have at most one primary ingredient");
                }
                hasPrimary = true;
            }
            BigDecimal perUnit = lineRequest.getQuantityPerUnit();
            if (perUnit == null || perUnit.signum() <= 0) {
                throw new ValidationException("Quantity per unit of " + ingredient.getName()
                        + " must be greater than zero");
            }
            if (perUnit.stripTrailingZeros().scale() > UnitType.STORAGE_SCALE) {
                throw new ValidationException("Quantity per unit of " + ingredient.getName()
                        + " allows at most " + UnitType.STORAGE_SCALE + " decimal places");
            }

            RecipeLine line = new RecipeLine();
            line.setIngredient(ingredient);
            line.setQuantityPerUnit(perUnit);
            line.setPrimary(lineRequest.isPrimary());
            variant.addRecipeLine(line);
        }

        variant = variantRepository.save(variant);
        log.info("Created variant {} at {} with {} recipe line(s)", variant.getDisplayName(),
                variant.getPrice().toPlainString(), variant.getRecipeLines().size());
        return VariantResponse.from(variant);
    }

    @Transactional
    public VariantResponse deactivateVariant(Long variantId) {
        ProductVariant variant = variantRepository.findById(variantId)
                .orElseThrow(() -> new NotFoundException("Product variant", variantId));
        if (variant.isActive()) {
            variant.setActive(false);
            variant = variantRepository.save(variant);
            auditService.log("DEACTIVATE_VARIANT", variant.getDisplayName());
        }
        return VariantResponse.from(variant);
    }

    @Transactional(readOnly = true)
    public List<VariantResponse> listActiveVariants() {
        return variantRepository.findActiveWithRecipe().stream()
                .map(VariantResponse::from)
                .sorted((a, b) -> a.id().compareTo(b.id()))
                .collect(Collectors.toList());
    }
}
