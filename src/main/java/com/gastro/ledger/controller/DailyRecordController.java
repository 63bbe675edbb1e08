package com.gastro.ledger.controller;

import com.gastro.ledger.dto.CloseDayRequest;
import com.gastro.ledger.dto.ClosingResult;
import com.gastro.ledger.dto.DailyRecordResponse;
import com.gastro.ledger.dto.OpenDayRequest;
import com.gastro.ledger.dto.ReconciliationReport;
import com.gastro.ledger.dto.UsageItem;
import com.gastro.ledger.service.ClosingCalculatorService;
import com.gastro.ledger.service.DailyRecordService;
import com.gastro.ledger.service.SalesReconciliationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/days")
public class DailyRecordController {

    private final DailyRecordService dailyRecordService;
    private final ClosingCalculatorService closingCalculatorService;
    private final SalesReconciliationService reconciliationService;

    public DailyRecordController(DailyRecordService dailyRecordService,
            ClosingCalculatorService closingCalculatorService,
            SalesReconciliationService reconciliationService) {
        this.dailyRecordService = dailyRecordService;
        this.closingCalculatorService = closingCalculatorService;
        this.reconciliationService = reconciliationService;
    }

    @PostMapping
    public ResponseEntity<DailyRecordResponse> openDay(@Valid @RequestBody OpenDayRequest request) {
        DailyRecordResponse day = dailyRecordService.openDay(request.getDate(), request.getOpeningInventory(),
                request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(day);
    }

    @GetMapping("/current")
    public ResponseEntity<DailyRecordResponse> currentDay() {
        return ResponseEntity.ok(dailyRecordService.getCurrentDay());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DailyRecordResponse> getDay(@PathVariable Long id) {
        return ResponseEntity.ok(dailyRecordService.getDay(id));
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<ClosingResult> closeDay(@PathVariable Long id, @Valid @RequestBody CloseDayRequest request) {
        return ResponseEntity.ok(dailyRecordService.closeDay(id, request.getClosingInventory(), request.getNotes()));
    }

    @GetMapping("/{id}/usage")
    public ResponseEntity<List<UsageItem>> usage(@PathVariable Long id) {
        return ResponseEntity.ok(closingCalculatorService.computeUsage(id));
    }

    @PostMapping("/{id}/usage-preview")
    public ResponseEntity<List<UsageItem>> previewUsage(@PathVariable Long id,
            @Valid @RequestBody CloseDayRequest request) {
        return ResponseEntity.ok(closingCalculatorService.previewUsage(id, request.getClosingInventory()));
    }

    @GetMapping("/{id}/reconciliation")
    public ResponseEntity<ReconciliationReport> reconciliation(@PathVariable Long id) {
        return ResponseEntity.ok(reconciliationService.reconcile(id));
    }
}
