package com.gastro.ledger.controller;

import com.gastro.ledger.dto.BatchResponse;
import com.gastro.ledger.dto.ConsumptionResult;
import com.gastro.ledger.dto.DeliveryRequest;
import com.gastro.ledger.dto.ExpiryAlertReport;
import com.gastro.ledger.dto.IngredientStockSummary;
import com.gastro.ledger.dto.SpoilageRequest;
import com.gastro.ledger.dto.TransferRequest;
import com.gastro.ledger.model.StockLocation;
import com.gastro.ledger.service.ExpiryMonitorService;
import com.gastro.ledger.service.StockLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/stock")
public class StockController {

    private final StockLedgerService stockLedgerService;
    private final ExpiryMonitorService expiryMonitorService;

    public StockController(StockLedgerService stockLedgerService, ExpiryMonitorService expiryMonitorService) {
        this.stockLedgerService = stockLedgerService;
        this.expiryMonitorService = expiryMonitorService;
    }

    @PostMapping("/deliveries")
    public ResponseEntity<BatchResponse> delivery(@Valid @RequestBody DeliveryRequest request) {
        BatchResponse batch = stockLedgerService.applyDelivery(request.getIngredientId(), request.getQuantity(),
                request.getDestination(), request.getExpiryDate(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(batch);
    }

    @PostMapping("/transfers")
    public ResponseEntity<ConsumptionResult> transfer(@Valid @RequestBody TransferRequest request) {
        return ResponseEntity.ok(stockLedgerService.applyTransfer(request.getIngredientId(), request.getQuantity(),
                request.getFrom(), request.getTo()));
    }

    @PostMapping("/spoilage")
    public ResponseEntity<ConsumptionResult> spoilage(@Valid @RequestBody SpoilageRequest request) {
        return ResponseEntity.ok(stockLedgerService.applySpoilage(request.getIngredientId(), request.getQuantity(),
                request.getReason(), request.getLocation(), request.getNotes()));
    }

    @GetMapping("/expiry-alerts")
    public ResponseEntity<ExpiryAlertReport> expiryAlerts() {
        return ResponseEntity.ok(expiryMonitorService.alertsForActiveBatches());
    }

    @GetMapping("/ingredients/{ingredientId}/batches")
    public ResponseEntity<List<BatchResponse>> batches(@PathVariable Long ingredientId,
            @RequestParam(required = false) StockLocation location,
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(stockLedgerService.getBatches(ingredientId, location, activeOnly));
    }

    @GetMapping("/ingredients/{ingredientId}/summary")
    public ResponseEntity<IngredientStockSummary> summary(@PathVariable Long ingredientId,
            @RequestParam(required = false) StockLocation location) {
        return ResponseEntity.ok(stockLedgerService.getIngredientStock(ingredientId, location));
    }
}
