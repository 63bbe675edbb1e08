package com.gastro.ledger.service;

import com.gastro.ledger.dto.ClosingResult;
import com.gastro.ledger.dto.DailyRecordResponse;
import com.gastro.ledger.dto.DiscrepancyAlert;
import com.gastro.ledger.dto.SnapshotEntry;
import com.gastro.ledger.dto.SnapshotLine;
import com.gastro.ledger.dto.UsageItem;
import com.gastro.ledger.exception.ConflictException;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.exception.StateException;
import com.gastro.ledger.exception.ValidationException;
import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.DayStatus;
import com.gastro.ledger.model.DiscrepancySeverity;
import com.gastro.ledger.model.Ingredient;
import com.gastro.ledger.model.InventorySnapshot;
import com.gastro.ledger.model.SnapshotType;
import com.gastro.ledger.repository.DailyRecordRepository;
import com.gastro.ledger.repository.IngredientRepository;
import com.gastro.ledger.repository.InventorySnapshotRepository;
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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class DailyRecordService {

    private final DailyRecordRepository dailyRecordRepository;
    private final InventorySnapshotRepository snapshotRepository;
    private final IngredientRepository ingredientRepository;
    private final ClosingCalculatorService closingCalculatorService;
    private final AuditService auditService;
    private final Clock clock;

    public DailyRecordService(DailyRecordRepository dailyRecordRepository,
            InventorySnapshotRepository snapshotRepository,
            IngredientRepository ingredientRepository,
            ClosingCalculatorService closingCalculatorService,
            AuditService auditService,
            Clock clock) {
        this.dailyRecordRepository = dailyRecordRepository;
        this.snapshotRepository = snapshotRepository;
        this.ingredientRepository = ingredientRepository;
        this.closingCalculatorService = closingCalculatorService;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Opens a business day with one opening count per active ingredient. At
     * most one day is open at a time; the database enforces it through the
     * unique open marker, so a lost race also ends in a conflict.
     */
    @Transactional
    public DailyRecordResponse openDay(LocalDate date, List<SnapshotEntry> openingCounts, String notes) {
        LocalDate dayDate = date != null ? date : LocalDate.now(clock);
        if (dailyRecordRepository.existsByDate(dayDate)) {
            throw new ConflictException("A daily record for " + dayDate + " already exists");
        }
        dailyRecordRepository.findFirstByStatus(DayStatus.OPEN).ifPresent(open -> {
            throw new ConflictException("Day " + open.getDate() + " is still open; close it first");
        });
        Map<Long, Ingredient> tracked = new HashMap<>();
        ingredientRepository.findByActiveTrueOrderByNameAsc().forEach(i -> tracked.put(i.getId(), i));
        Map<Long, BigDecimal> counts = resolveOpeningCounts(tracked, openingCounts);

        DailyRecord day = new DailyRecord();
        day.setDate(dayDate);
        day.setNotes(notes);
        day.markOpen(LocalDateTime.now(clock));
        try {
            day = dailyRecordRepository.saveAndFlush(day);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Another day was opened concurrently");
        }

        List<SnapshotLine> lines = new ArrayList<>();
        for (Map.Entry<Long, BigDecimal> count : counts.entrySet()) {
            InventorySnapshot snapshot = snapshot(day, tracked.get(count.getKey()), SnapshotType.OPEN,
                    count.getValue());
            lines.add(SnapshotLine.from(snapshotRepository.save(snapshot)));
        }
        lines.sort((a, b) -> a.ingredientName().compareTo(b.ingredientName()));

        log.info("Opened day {} (#{}) with {} opening counts", dayDate, day.getId(), lines.size());
        auditService.log("OPEN_DAY", "Day " + dayDate + " opened with " + lines.size() + " counts");
        return DailyRecordResponse.from(day, lines);
    }

    /**
     * Closes the day with one count per ingredient opened that day, computes
     * usage and moves the day to CLOSED. Sales and voids wait on the row lock
     * and then see the day closed.
     */
    @Retryable(retryFor = PessimisticLockingFailureException.class, maxAttempts = 2, backoff = @Backoff(delay = 100))
    @Transactional
    public ClosingResult closeDay(Long dailyRecordId, List<SnapshotEntry> closingCounts, String notes) {
        DailyRecord day = dailyRecordRepository.findByIdForUpdate(dailyRecordId)
                .orElseThrow(() -> new NotFoundException("Daily record", dailyRecordId));
        if (!day.isOpen()) {
            throw new StateException("Day " + day.getDate() + " is already closed", StateException.DAY_CLOSED);
        }

        List<InventorySnapshot> opening = snapshotRepository.findForDay(dailyRecordId, SnapshotType.OPEN);
        Map<Long, BigDecimal> counts = closingCalculatorService.resolveClosingCounts(opening, closingCounts);

        List<SnapshotLine> lines = new ArrayList<>();
        for (InventorySnapshot open : opening) {
            Ingredient ingredient = open.getIngredient();
            InventorySnapshot closing = snapshot(day, ingredient, SnapshotType.CLOSE, counts.get(ingredient.getId()));
            lines.add(SnapshotLine.from(snapshotRepository.save(closing)));
        }

        List<UsageItem> usage = closingCalculatorService.calculate(day, counts);
        List<DiscrepancyAlert> alerts = closingCalculatorService.alertsFor(usage);

        day.markClosed(LocalDateTime.now(clock));
        if (notes != null && !notes.isBlank()) {
            day.setNotes(day.getNotes() == null || day.getNotes().isBlank() ? notes : day.getNotes() + "\n" + notes);
        }
        DailyRecord closed = dailyRecordRepository.save(day);

        alerts.stream()
                .filter(alert -> alert.severity() == DiscrepancySeverity.CRITICAL)
                .forEach(alert -> log.warn("Day {}: {}", closed.getDate(), alert.message()));
        log.info("Closed day {} (#{}): {} ingredients, {} discrepancy alert(s)", closed.getDate(), closed.getId(),
                usage.size(), alerts.size());
        auditService.log("CLOSE_DAY", "Day " + closed.getDate() + " closed with " + alerts.size() + " alert(s)");
        return new ClosingResult(DailyRecordResponse.from(closed, lines), usage, alerts);
    }

    @Transactional(readOnly = true)
    public DailyRecordResponse getCurrentDay() {
        DailyRecord day = dailyRecordRepository.findFirstByStatus(DayStatus.OPEN)
                .orElseThrow(() -> new NotFoundException("No day is currently open"));
        return withSnapshots(day);
    }

    @Transactional(readOnly = true)
    public DailyRecordResponse getDay(Long dailyRecordId) {
        DailyRecord day = dailyRecordRepository.findById(dailyRecordId)
                .orElseThrow(() -> new NotFoundException("Daily record", dailyRecordId));
        return withSnapshots(day);
    }

    private DailyRecordResponse withSnapshots(DailyRecord day) {
        SnapshotType type = day.isOpen() ? SnapshotType.OPEN : SnapshotType.CLOSE;
        List<SnapshotLine> lines = snapshotRepository.findForDay(day.getId(), type).stream()
                .map(SnapshotLine::from)
                .collect(Collectors.toList());
        return DailyRecordResponse.from(day, lines);
    }

    // Exactly one non-negative count per active ingredient
    private Map<Long, BigDecimal> resolveOpeningCounts(Map<Long, Ingredient> tracked, List<SnapshotEntry> entries) {
        Map<Long, BigDecimal> counts = new LinkedHashMap<>();
        for (SnapshotEntry entry : entries != null ? entries : List.<SnapshotEntry>of()) {
            Ingredient ingredient = tracked.get(entry.getIngredientId());
            if (ingredient == null) {
                Ingredient known = ingredientRepository.findById(entry.getIngredientId())
                        .orElseThrow(() -> new NotFoundException("Ingredient", entry.getIngredientId()));
                throw new ValidationException(known.getName() + " is not an active ingredient");
            }
            if (counts.containsKey(ingredient.getId())) {
                throw new ValidationException("Duplicate opening count for " + ingredient.getName());
            }
            counts.put(ingredient.getId(), ingredient.getUnitType()
                    .requireNonNegative(entry.getQuantity(), "Opening count of " + ingredient.getName()));
        }

        List<String> missing = tracked.values().stream()
                .filter(i -> !counts.containsKey(i.getId()))
                .map(Ingredient::getName)
                .sorted()
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing opening count for: " + String.join(", ", missing));
        }
        return counts;
    }

    private static InventorySnapshot snapshot(DailyRecord day, Ingredient ingredient, SnapshotType type,
            BigDecimal quantity) {
        InventorySnapshot snapshot = new InventorySnapshot();
        snapshot.setDailyRecord(day);
        snapshot.setIngredient(ingredient);
        snapshot.setSnapshotType(type);
        snapshot.setQuantity(quantity);
        return snapshot;
    }
}
