package com.gastro.ledger.controller;

import com.gastro.ledger.dto.DayTotals;
import com.gastro.ledger.dto.RecordSaleRequest;
import com.gastro.ledger.dto.RecordedSaleResponse;
import com.gastro.ledger.dto.VoidSaleRequest;
import com.gastro.ledger.service.RecordedSaleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class RecordedSaleController {

    private final RecordedSaleService recordedSaleService;

    public RecordedSaleController(RecordedSaleService recordedSaleService) {
        this.recordedSaleService = recordedSaleService;
    }

    @PostMapping("/days/{dayId}/sales")
    public ResponseEntity<RecordedSaleResponse> record(@PathVariable Long dayId,
            @Valid @RequestBody RecordSaleRequest request) {
        RecordedSaleResponse sale = recordedSaleService.record(dayId, request.getVariantId(), request.getQuantity(),
                request.getShiftId());
        return ResponseEntity.status(HttpStatus.CREATED).body(sale);
    }

    @GetMapping("/days/{dayId}/sales")
    public ResponseEntity<List<RecordedSaleResponse>> daySales(@PathVariable Long dayId,
            @RequestParam(defaultValue = "false") boolean includeVoided) {
        return ResponseEntity.ok(recordedSaleService.getDaySales(dayId, includeVoided));
    }

    @GetMapping("/days/{dayId}/sales/totals")
    public ResponseEntity<DayTotals> dayTotals(@PathVariable Long dayId) {
        return ResponseEntity.ok(recordedSaleService.getDayTotals(dayId));
    }

    @PostMapping("/sales/{saleId}/void")
    public ResponseEntity<RecordedSaleResponse> voidSale(@PathVariable Long saleId,
            @Valid @RequestBody VoidSaleRequest request) {
        return ResponseEntity.ok(recordedSaleService.voidSale(saleId, request.getReason(), request.getNotes()));
    }
}
