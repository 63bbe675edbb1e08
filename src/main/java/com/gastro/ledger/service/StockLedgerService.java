package com.gastro.ledger.service;

import com.gastro.ledger.dto.BatchResponse;
import com.gastro.ledger.dto.BatchStockLine;
import com.gastro.ledger.dto.ConsumedBatch;
import com.gastro.ledger.dto.ConsumptionResult;
import com.gastro.ledger.dto.IngredientStockSummary;
import com.gastro.ledger.exception.InsufficientStockException;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.exception.ValidationException;
import com.gastro.ledger.model.AlertLevel;
import com.gastro.ledger.model.BatchDeduction;
import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.DayStatus;
import com.gastro.ledger.model.Ingredient;
import com.gastro.ledger.model.IngredientBatch;
import com.gastro.ledger.model.MovementType;
import com.gastro.ledger.model.SpoilageReason;
import com.gastro.ledger.model.StockLocation;
import com.gastro.ledger.model.StockMovement;
import com.gastro.ledger.repository.BatchDeductionRepository;
import com.gastro.ledger.repository.DailyRecordRepository;
import com.gastro.ledger.repository.IngredientBatchRepository;
import com.gastro.ledger.repository.IngredientRepository;
import com.gastro.ledger.repository.StockMovementRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Batch-level stock. Every quantity leaving a location is drawn from its
 * batches in {@link IngredientBatch#FIFO_ORDER}; a request larger than the
 * eligible stock fails before anything is touched.
 */
@Slf4j
@Service
public class StockLedgerService {

    private static final String BATCH_PREFIX = "B-";

    private final IngredientRepository ingredientRepository;
    private final IngredientBatchRepository batchRepository;
    private final StockMovementRepository movementRepository;
    private final BatchDeductionRepository deductionRepository;
    private final DailyRecordRepository dailyRecordRepository;
    private final ExpiryMonitorService expiryMonitorService;
    private final AuditService auditService;
    private final Clock clock;

    public StockLedgerService(IngredientRepository ingredientRepository,
            IngredientBatchRepository batchRepository,
            StockMovementRepository movementRepository,
            BatchDeductionRepository deductionRepository,
            DailyRecordRepository dailyRecordRepository,
            ExpiryMonitorService expiryMonitorService,
            AuditService auditService,
            Clock clock) {
        this.ingredientRepository = ingredientRepository;
        this.batchRepository = batchRepository;
        this.movementRepository = movementRepository;
        this.deductionRepository = deductionRepository;
        this.dailyRecordRepository = dailyRecordRepository;
        this.expiryMonitorService = expiryMonitorService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Retryable(retryFor = { PessimisticLockingFailureException.class, DataIntegrityViolationException.class },
            maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public BatchResponse applyDelivery(Long ingredientId, BigDecimal quantity, StockLocation destination,
            LocalDate expiryDate, String notes) {
        Ingredient ingredient = findIngredient(ingredientId);
        BigDecimal checked = ingredient.getUnitType().requirePositive(quantity, "Delivery quantity");
        StockLocation target = destination != null ? destination : StockLocation.STORAGE;
        DailyRecord day = currentOpenDay();
        LocalDateTime now = LocalDateTime.now(clock);

        // flushed so a batch number taken concurrently fails here and the call is retried
        IngredientBatch batch = newBatch(ingredient, checked, target, expiryDate, notes, nextBatchSequence(), now);
        batch = batchRepository.saveAndFlush(batch);

        StockMovement movement = new StockMovement();
        movement.setIngredient(ingredient);
        movement.setMovementType(MovementType.DELIVERY);
        movement.setQuantity(checked);
        movement.setToLocation(target);
        movement.setNotes(notes);
        movement.setDailyRecord(day);
        movement.setCreatedAt(now);
        movementRepository.save(movement);

        log.info("Delivery of {} {} {} to {} as batch {}", checked.toPlainString(), ingredient.getUnitLabel(),
                ingredient.getName(), target, batch.getBatchNumber());
        auditService.log("DELIVERY", String.format("Batch %s: %s %s of %s to %s", batch.getBatchNumber(),
                checked.toPlainString(), ingredient.getUnitLabel(), ingredient.getName(), target));
        return BatchResponse.from(batch);
    }

    @Retryable(retryFor = { PessimisticLockingFailureException.class, DataIntegrityViolationException.class },
            maxAttempts = 3, backoff = @Backoff(delay = 100))
    @Transactional
    public ConsumptionResult applyTransfer(Long ingredientId, BigDecimal quantity, StockLocation from,
            StockLocation to) {
        StockLocation source = from != null ? from : StockLocation.STORAGE;
        StockLocation target = to != null ? to : StockLocation.SHOP;
        if (source == target) {
            throw new ValidationException("Transfer source and destination must differ");
        }
        Ingredient ingredient = findIngredient(ingredientId);
        BigDecimal checked = ingredient.getUnitType().requirePositive(quantity, "Transfer quantity");

        ConsumptionResult result = consume(ingredient, checked, source, target, MovementType.TRANSFER, null, null);
        auditService.log("TRANSFER", String.format("%s %s of %s from %s to %s", checked.toPlainString(),
                ingredient.getUnitLabel(), ingredient.getName(), source, target));
        return result;
    }

    @Retryable(retryFor = PessimisticLockingFailureException.class, maxAttempts = 2, backoff = @Backoff(delay = 100))
    @Transactional
    public ConsumptionResult applySpoilage(Long ingredientId, BigDecimal quantity, SpoilageReason reason,
            StockLocation location, String notes) {
        if (reason == null) {
            throw new ValidationException("Spoilage reason is required");
        }
        Ingredient ingredient = findIngredient(ingredientId);
        BigDecimal checked = ingredient.getUnitType().requirePositive(quantity, "Spoilage quantity");
        StockLocation source = location != null ? location : StockLocation.SHOP;

        ConsumptionResult result = consume(ingredient, checked, source, null, MovementType.SPOILAGE, reason, notes);
        auditService.log("SPOILAGE", String.format("%s %s of %s at %s (%s)", checked.toPlainString(),
                ingredient.getUnitLabel(), ingredient.getName(), source, reason));
        return result;
    }

    /**
     * Draws stock for a recorded sale. Runs inside the caller's transaction so
     * a shortage aborts the sale as well.
     */
    @Transactional
    public ConsumptionResult consumeForSale(Long ingredientId, BigDecimal quantity, StockLocation location) {
        Ingredient ingredient = findIngredient(ingredientId);
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Sale consumption must be greater than zero");
        }
        StockLocation source = location != null ? location : StockLocation.SHOP;
        return consume(ingredient, quantity, source, null, MovementType.SALE, null, null);
    }

    @Transactional(readOnly = true)
    public List<BatchResponse> getBatches(Long ingredientId, StockLocation location, boolean activeOnly) {
        findIngredient(ingredientId);
        return batchRepository.findForIngredient(ingredientId, location, activeOnly).stream()
                .sorted(IngredientBatch.FIFO_ORDER)
                .map(BatchResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public IngredientStockSummary getIngredientStock(Long ingredientId, StockLocation location) {
        Ingredient ingredient = findIngredient(ingredientId);
        List<IngredientBatch> batches = new ArrayList<>(batchRepository.findForIngredient(ingredientId, location, true));
        batches.sort(IngredientBatch.FIFO_ORDER);

        BigDecimal total = BigDecimal.ZERO;
        int expiringSoon = 0;
        List<BatchStockLine> lines = new ArrayList<>();
        for (int i = 0; i < batches.size(); i++) {
            IngredientBatch batch = batches.get(i);
            total = total.add(batch.getRemainingQuantity());
            Long daysLeft = expiryMonitorService.daysUntilExpiry(batch.getExpiryDate());
            AlertLevel level = expiryMonitorService.alertLevel(daysLeft);
            if (level != AlertLevel.NONE) {
                expiringSoon++;
            }
            lines.add(new BatchStockLine(batch.getId(), batch.getBatchNumber(), batch.getLocation(),
                    batch.getExpiryDate(), batch.getRemainingQuantity(), i + 1, daysLeft, level));
        }
        return new IngredientStockSummary(ingredient.getId(), ingredient.getName(), ingredient.getUnitLabel(),
                location, total, batches.size(), expiringSoon, lines);
    }

    private ConsumptionResult consume(Ingredient ingredient, BigDecimal quantity, StockLocation from,
            StockLocation to, MovementType type, SpoilageReason reason, String notes) {
        DailyRecord day = currentOpenDay();
        List<IngredientBatch> eligible = new ArrayList<>(
                batchRepository.findEligibleForUpdate(ingredient.getId(), from));
        eligible.sort(IngredientBatch.FIFO_ORDER);

        BigDecimal available = eligible.stream()
                .map(IngredientBatch::getRemainingQuantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (available.compareTo(quantity) < 0) {
            throw new InsufficientStockException(ingredient.getName(), from.name(), available, quantity);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        StockMovement movement = new StockMovement();
        movement.setIngredient(ingredient);
        movement.setMovementType(type);
        movement.setQuantity(quantity);
        movement.setFromLocation(from);
        movement.setToLocation(to);
        movement.setSpoilageReason(reason);
        movement.setNotes(notes);
        movement.setDailyRecord(day);
        movement.setCreatedAt(now);
        movement = movementRepository.save(movement);

        List<ConsumedBatch> consumed = new ArrayList<>();
        List<BatchResponse> created = new ArrayList<>();
        int sequence = to != null ? nextBatchSequence() : 0;
        BigDecimal outstanding = quantity;
        for (IngredientBatch batch : eligible) {
            if (outstanding.signum() == 0) {
                break;
            }
            BigDecimal taken = batch.draw(outstanding);
            outstanding = outstanding.subtract(taken);
            batchRepository.save(batch);

            BatchDeduction deduction = new BatchDeduction();
            deduction.setBatch(batch);
            deduction.setMovement(movement);
            deduction.setDailyRecord(day);
            deduction.setQuantity(taken);
            deduction.setReason(type);
            deduction.setCreatedAt(now);
            deductionRepository.save(deduction);

            log.debug("{}: took {} from batch {} ({} left)", type, taken.toPlainString(), batch.getBatchNumber(),
                    batch.getRemainingQuantity().toPlainString());
            consumed.add(new ConsumedBatch(batch.getId(), batch.getBatchNumber(), batch.getExpiryDate(), taken,
                    batch.getRemainingQuantity(), !batch.isActive()));

            if (to != null) {
                IngredientBatch arrived = newBatch(ingredient, taken, to, batch.getExpiryDate(),
                        "Transferred from " + batch.getBatchNumber(), sequence++, now);
                created.add(BatchResponse.from(batchRepository.saveAndFlush(arrived)));
            }
        }

        log.info("{} of {} {} {} from {}{}: {} batch(es) drawn", type, quantity.toPlainString(),
                ingredient.getUnitLabel(), ingredient.getName(), from, to != null ? " to " + to : "",
                consumed.size());
        return new ConsumptionResult(movement.getId(), type, ingredient.getId(), ingredient.getName(), quantity,
                from, to, consumed, created);
    }

    private IngredientBatch newBatch(Ingredient ingredient, BigDecimal quantity, StockLocation location,
            LocalDate expiryDate, String notes, int sequence, LocalDateTime createdAt) {
        IngredientBatch batch = new IngredientBatch();
        batch.setIngredient(ingredient);
        batch.setBatchNumber(batchPrefix() + String.format("%03d", sequence));
        batch.setInitialQuantity(quantity);
        batch.setRemainingQuantity(quantity);
        batch.setLocation(location);
        batch.setExpiryDate(expiryDate);
        batch.setNotes(notes);
        batch.setCreatedAt(createdAt);
        return batch;
    }

    // Batch numbers: B-YYYYMMDD-NNN, numbered per calendar day
    private int nextBatchSequence() {
        String prefix = batchPrefix();
        int highest = 0;
        for (String number : batchRepository.findBatchNumbersStartingWith(prefix)) {
            try {
                highest = Math.max(highest, Integer.parseInt(number.substring(prefix.length())));
            } catch (NumberFormatException e) {
                log.debug("Skipping non-sequential batch number {}", number);
            }
        }
        return highest + 1;
    }

    private String batchPrefix() {
        return BATCH_PREFIX + LocalDate.now(clock).format(DateTimeFormatter.BASIC_ISO_DATE) + "-";
    }

    /**
     * The day a movement belongs to, read under a shared lock so a running
     * close finishes first. A day closed meanwhile attributes to no day.
     */
    private DailyRecord currentOpenDay() {
        return dailyRecordRepository.findByStatusForShare(DayStatus.OPEN)
                .filter(DailyRecord::isOpen)
                .orElse(null);
    }

    private Ingredient findIngredient(Long ingredientId) {
        return ingredientRepository.findById(ingredientId)
                .orElseThrow(() -> new NotFoundException("Ingredient", ingredientId));
    }
}
