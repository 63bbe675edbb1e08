package com.gastro.ledger.service;

import com.gastro.ledger.dto.DayTotals;
import com.gastro.ledger.dto.RecordedSaleResponse;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.exception.StateException;
import com.gastro.ledger.exception.ValidationException;
import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.ProductVariant;
import com.gastro.ledger.model.RecipeLine;
import com.gastro.ledger.model.RecordedSale;
import com.gastro.ledger.model.StockLocation;
import com.gastro.ledger.model.VoidReason;
import com.gastro.ledger.repository.DailyRecordRepository;
import com.gastro.ledger.repository.ProductVariantRepository;
import com.gastro.ledger.repository.RecordedSaleRepository;
import com.gastro.ledger.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RecordedSaleService {

    private final RecordedSaleRepository recordedSaleRepository;
    private final DailyRecordRepository dailyRecordRepository;
    private final ProductVariantRepository variantRepository;
    private final StockLedgerService stockLedgerService;
    private final SettingsService settingsService;
    private final AuditService auditService;
    private final Clock clock;

    public RecordedSaleService(RecordedSaleRepository recordedSaleRepository,
            DailyRecordRepository dailyRecordRepository,
            ProductVariantRepository variantRepository,
            StockLedgerService stockLedgerService,
            SettingsService settingsService,
            AuditService auditService,
            Clock clock) {
        this.recordedSaleRepository = recordedSaleRepository;
        this.dailyRecordRepository = dailyRecordRepository;
        this.variantRepository = variantRepository;
        this.stockLedgerService = stockLedgerService;
        this.settingsService = settingsService;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Records a till tap. The price comes from the variant, never from the
     * caller. With real-time depletion on, every recipe line is drawn from
     * shop stock in the same transaction and a shortage aborts the sale.
     */
    @Retryable(retryFor = PessimisticLockingFailureException.class, maxAttempts = 2, backoff = @Backoff(delay = 100))
    @Transactional
    public RecordedSaleResponse record(Long dailyRecordId, Long variantId, int quantity, Long shiftId) {
        if (quantity <= 0) {
            throw new ValidationException("Quantity must be greater than zero");
        }
        // Shared lock: waits for a running close, then sees its outcome
        DailyRecord day = dailyRecordRepository.findByIdForShare(dailyRecordId)
                .orElseThrow(() -> new NotFoundException("Daily record", dailyRecordId));
        if (!day.isOpen()) {
            throw new StateException("Day " + day.getDate() + " is not open", StateException.DAY_NOT_OPEN);
        }
        ProductVariant variant = variantRepository.findById(variantId)
                .orElseThrow(() -> new NotFoundException("Product variant", variantId));
        if (!variant.isActive()) {
            throw new ValidationException(variant.getDisplayName() + " is not available for sale");
        }

        RecordedSale sale = new RecordedSale();
        sale.setDailyRecord(day);
        sale.setProductVariant(variant);
        sale.setQuantity(quantity);
        sale.setUnitPrice(variant.getPrice());
        sale.setShiftId(shiftId);
        sale.setRecordedAt(LocalDateTime.now(clock));
        sale = recordedSaleRepository.save(sale);

        if (settingsService.isRealtimeDepletionEnabled()) {
            for (RecipeLine line : variant.getRecipeLines()) {
                stockLedgerService.consumeForSale(line.getIngredient().getId(),
                        line.getQuantityPerUnit().multiply(BigDecimal.valueOf(quantity)), StockLocation.SHOP);
            }
        }

        log.info("Recorded sale #{}: {} x {} at {} on day {}", sale.getId(), quantity, variant.getDisplayName(),
                sale.getUnitPrice().toPlainString(), day.getDate());
        return RecordedSaleResponse.from(sale);
    }

    /**
     * Soft-cancels a sale. The row stays for audit; only the void fields are
     * set, once.
     */
    @Retryable(retryFor = PessimisticLockingFailureException.class, maxAttempts = 2, backoff = @Backoff(delay = 100))
    @Transactional
    public RecordedSaleResponse voidSale(Long saleId, VoidReason reason, String notes) {
        if (reason == null) {
            throw new ValidationException("Void reason is required");
        }
        RecordedSale sale = recordedSaleRepository.findByIdForUpdate(saleId)
                .orElseThrow(() -> new NotFoundException("Recorded sale", saleId));
        Long dayId = sale.getDailyRecord().getId();
        DailyRecord day = dailyRecordRepository.findByIdForShare(dayId)
                .orElseThrow(() -> new NotFoundException("Daily record", dayId));
        if (!day.isOpen()) {
            throw new StateException("Cannot void a sale of closed day " + day.getDate(), StateException.DAY_CLOSED);
        }
        if (sale.isVoided()) {
            throw new StateException("Sale #" + saleId + " is already voided", StateException.SALE_ALREADY_VOIDED);
        }

        sale.setVoidedAt(LocalDateTime.now(clock));
        sale.setVoidReason(reason);
        sale.setVoidNotes(notes);
        recordedSaleRepository.save(sale);

        log.info("Voided sale #{} ({}) on day {}", saleId, reason, day.getDate());
        auditService.log("VOID_SALE", String.format("Sale #%d: %d x %s, reason %s%s", saleId, sale.getQuantity(),
                sale.getProductVariant().getDisplayName(), reason, notes != null ? ", " + notes : ""));
        return RecordedSaleResponse.from(sale);
    }

    @Transactional(readOnly = true)
    public List<RecordedSaleResponse> getDaySales(Long dailyRecordId, boolean includeVoided) {
        requireDay(dailyRecordId);
        List<RecordedSale> sales = includeVoided
                ? recordedSaleRepository.findByDailyRecordIdOrderByRecordedAtDescIdDesc(dailyRecordId)
                : recordedSaleRepository.findByDailyRecordIdAndVoidedAtIsNullOrderByRecordedAtDescIdDesc(dailyRecordId);
        return sales.stream().map(RecordedSaleResponse::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DayTotals getDayTotals(Long dailyRecordId) {
        requireDay(dailyRecordId);
        List<Object[]> rows = recordedSaleRepository.sumDayTotals(dailyRecordId);
        if (rows.isEmpty()) {
            return new DayTotals(dailyRecordId, BigDecimal.ZERO.setScale(2), 0, 0);
        }
        Object[] row = rows.get(0);
        return new DayTotals(dailyRecordId,
                Numbers.toBigDecimal(row[2]).setScale(2, RoundingMode.HALF_UP),
                Numbers.toLong(row[0]),
                Numbers.toLong(row[1]));
    }

    private void requireDay(Long dailyRecordId) {
        if (!dailyRecordRepository.existsById(dailyRecordId)) {
            throw new NotFoundException("Daily record", dailyRecordId);
        }
    }
}
