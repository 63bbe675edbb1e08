package com.gastro.ledger.controller;

import com.gastro.ledger.dto.IngredientRequest;
import com.gastro.ledger.dto.IngredientResponse;
import com.gastro.ledger.dto.UnitTypeChangeRequest;
import com.gastro.ledger.dto.VariantRequest;
import com.gastro.ledger.dto.VariantResponse;
import com.gastro.ledger.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping("/ingredients")
    public ResponseEntity<List<IngredientResponse>> ingredients() {
        return ResponseEntity.ok(catalogService.listIngredients());
    }

    @PostMapping("/ingredients")
    public ResponseEntity<IngredientResponse> createIngredient(@Valid @RequestBody IngredientRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createIngredient(request));
    }

    @PutMapping("/ingredients/{id}/unit-type")
    public ResponseEntity<IngredientResponse> changeUnitType(@PathVariable Long id,
            @Valid @RequestBody UnitTypeChangeRequest request) {
        return ResponseEntity.ok(catalogService.changeUnitType(id, request.getUnitType()));
    }

    @GetMapping("/variants")
    public ResponseEntity<List<VariantResponse>> variants() {
        return ResponseEntity.ok(catalogService.listActiveVariants());
    }

    @PostMapping("/variants")
    public ResponseEntity<VariantResponse> createVariant(@Valid @RequestBody VariantRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createVariant(request));
    }

    @PostMapping("/variants/{id}/deactivate")
    public ResponseEntity<VariantResponse> deactivateVariant(@PathVariable Long id) {
        return ResponseEntity.ok(catalogService.deactivateVariant(id));
    }
}
