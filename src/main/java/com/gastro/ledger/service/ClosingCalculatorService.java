package com.gastro.ledger.service;

import com.gastro.ledger.dto.DiscrepancyAlert;
import com.gastro.ledger.dto.SnapshotEntry;
import com.gastro.ledger.dto.UsageItem;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.exception.StateException;
import com.gastro.ledger.exception.ValidationException;
import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.DiscrepancySeverity;
import com.gastro.ledger.model.Ingredient;
import com.gastro.ledger.model.InventorySnapshot;
import com.gastro.ledger.model.MovementType;
import com.gastro.ledger.model.SnapshotType;
import com.gastro.ledger.model.StockLocation;
import com.gastro.ledger.repository.DailyRecordRepository;
import com.gastro.ledger.repository.InventorySnapshotRepository;
import com.gastro.ledger.repository.RecordedSaleRepository;
import com.gastro.ledger.repository.StockMovementRepository;
import com.gastro.ledger.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-ingredient usage for a day:
 * {@code opening + deliveriesIn + transfersIn - transfersOut - spoilageOut - closing}.
 * Counts are taken at the shop, so only flows in and out of {@link StockLocation#SHOP} take part.
 */
@Slf4j
@Service
public class ClosingCalculatorService {

    static final BigDecimal OK_THRESHOLD = new BigDecimal("5");
    static final BigDecimal WARNING_THRESHOLD = new BigDecimal("10");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final DailyRecordRepository dailyRecordRepository;
    private final InventorySnapshotRepository snapshotRepository;
    private final StockMovementRepository movementRepository;
    private final RecordedSaleRepository recordedSaleRepository;

    public ClosingCalculatorService(DailyRecordRepository dailyRecordRepository,
            InventorySnapshotRepository snapshotRepository,
            StockMovementRepository movementRepository,
            RecordedSaleRepository recordedSaleRepository) {
        this.dailyRecordRepository = dailyRecordRepository;
        this.snapshotRepository = snapshotRepository;
        this.movementRepository = movementRepository;
        this.recordedSaleRepository = recordedSaleRepository;
    }

    @Transactional(readOnly = true)
    public List<UsageItem> computeUsage(Long dailyRecordId) {
        DailyRecord day = findDay(dailyRecordId);
        if (day.isOpen()) {
            throw new StateException("Day " + day.getDate() + " is still open; closing counts are not recorded yet",
                    StateException.DAY_STILL_OPEN);
        }
        Map<Long, BigDecimal> closing = snapshotRepository.findForDay(dailyRecordId, SnapshotType.CLOSE).stream()
                .collect(Collectors.toMap(s -> s.getIngredient().getId(), InventorySnapshot::getQuantity));
        return calculate(day, closing);
    }

    /**
     * Usage an open day would show if it were closed with the given counts.
     * Nothing is stored.
     */
    @Transactional(readOnly = true)
    public List<UsageItem> previewUsage(Long dailyRecordId, List<SnapshotEntry> closingCounts) {
        DailyRecord day = findDay(dailyRecordId);
        if (!day.isOpen()) {
            throw new StateException("Day " + day.getDate() + " is already closed", StateException.DAY_CLOSED);
        }
        List<InventorySnapshot> opening = snapshotRepository.findForDay(dailyRecordId, SnapshotType.OPEN);
        return calculate(day, resolveClosingCounts(opening, closingCounts));
    }

    /**
     * Checks the proposed closing counts against the day's opening snapshots:
     * exactly one non-negative count per opened ingredient, nothing else.
     */
    public Map<Long, BigDecimal> resolveClosingCounts(List<InventorySnapshot> opening, List<SnapshotEntry> entries) {
        Map<Long, Ingredient> opened = new LinkedHashMap<>();
        opening.forEach(s -> opened.put(s.getIngredient().getId(), s.getIngredient()));

        Map<Long, BigDecimal> counts = new HashMap<>();
        for (SnapshotEntry entry : entries != null ? entries : List.<SnapshotEntry>of()) {
            Ingredient ingredient = opened.get(entry.getIngredientId());
            if (ingredient == null) {
                throw new ValidationException("Ingredient " + entry.getIngredientId()
                        + " has no opening count for this day");
            }
            if (counts.containsKey(ingredient.getId())) {
                throw new ValidationException("Duplicate closing count for " + ingredient.getName());
            }
            counts.put(ingredient.getId(), ingredient.getUnitType()
                    .requireNonNegative(entry.getQuantity(), "Closing count of " + ingredient.getName()));
        }

        List<String> missing = opened.values().stream()
                .filter(i -> !counts.containsKey(i.getId()))
                .map(Ingredient::getName)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing closing count for: " + String.join(", ", missing));
        }
        return counts;
    }

    /**
     * Usage per ingredient that has an opening snapshot, in ingredient name
     * order. {@code closing} holds the counted quantity per ingredient id.
     */
    public List<UsageItem> calculate(DailyRecord day, Map<Long, BigDecimal> closing) {
        List<InventorySnapshot> opening = snapshotRepository.findForDay(day.getId(), SnapshotType.OPEN);
        Map<Long, ShopFlows> flows = shopFlows(day.getId());
        Map<Long, BigDecimal> expected = new HashMap<>();
        for (Object[] row : recordedSaleRepository.sumExpectedUsageByIngredient(day.getId())) {
            expected.put((Long) row[0], Numbers.toBigDecimal(row[1]));
        }
        log.debug("Day {}: {} opening snapshots, {} ingredients with flows, {} with expected usage",
                day.getId(), opening.size(), flows.size(), expected.size());

        List<UsageItem> items = new ArrayList<>();
        for (InventorySnapshot snapshot : opening) {
            Ingredient ingredient = snapshot.getIngredient();
            ShopFlows f = flows.getOrDefault(ingredient.getId(), new ShopFlows());
            BigDecimal expectedClosing = snapshot.getQuantity()
                    .add(f.deliveriesIn)
                    .add(f.transfersIn)
                    .subtract(f.transfersOut)
                    .subtract(f.spoilageOut);
            BigDecimal counted = Numbers.zeroIfNull(closing.get(ingredient.getId()));
            BigDecimal usage = expectedClosing.subtract(counted);
            BigDecimal expectedUsage = expected.getOrDefault(ingredient.getId(), BigDecimal.ZERO);
            BigDecimal percent = discrepancyPercent(usage, expectedUsage);

            items.add(new UsageItem(ingredient.getId(), ingredient.getName(), ingredient.getUnitType(),
                    ingredient.getUnitLabel(), snapshot.getQuantity(), f.deliveriesIn, f.transfersIn,
                    f.transfersOut, f.spoilageOut, expectedClosing, counted, usage, expectedUsage,
                    percent == null ? null : percent.setScale(2, RoundingMode.HALF_UP), severity(percent)));
        }
        return items;
    }

    public List<DiscrepancyAlert> alertsFor(List<UsageItem> usage) {
        return usage.stream()
                .filter(item -> item.severity() != DiscrepancySeverity.OK)
                .map(item -> new DiscrepancyAlert(item.ingredientId(), item.ingredientName(),
                        item.discrepancyPercent(), item.severity(),
                        String.format("%s: used %s %s, recipes account for %s (%s%%)", item.ingredientName(),
                                item.usage().toPlainString(), item.unitLabel(),
                                item.expectedUsage().toPlainString(),
                                item.discrepancyPercent().toPlainString())))
                .collect(Collectors.toList());
    }

    /**
     * Unrounded; severity is classified on this value and only the reported
     * figure is rounded to two decimals.
     */
    static BigDecimal discrepancyPercent(BigDecimal usage, BigDecimal expected) {
        if (expected.signum() <= 0) {
            return null;
        }
        return usage.subtract(expected).abs()
                .multiply(HUNDRED)
                .divide(expected, MathContext.DECIMAL64);
    }

    static DiscrepancySeverity severity(BigDecimal percent) {
        if (percent == null || percent.compareTo(OK_THRESHOLD) <= 0) {
            return DiscrepancySeverity.OK;
        }
        if (percent.compareTo(WARNING_THRESHOLD) <= 0) {
            return DiscrepancySeverity.WARNING;
        }
        return DiscrepancySeverity.CRITICAL;
    }

    private Map<Long, ShopFlows> shopFlows(Long dailyRecordId) {
        Map<Long, ShopFlows> flows = new HashMap<>();
        for (Object[] row : movementRepository.sumFlowsByIngredient(dailyRecordId)) {
            Long ingredientId = (Long) row[0];
            MovementType type = (MovementType) row[1];
            StockLocation from = (StockLocation) row[2];
            StockLocation to = (StockLocation) row[3];
            BigDecimal quantity = Numbers.toBigDecimal(row[4]);
            ShopFlows f = flows.computeIfAbsent(ingredientId, id -> new ShopFlows());

            switch (type) {
                case DELIVERY -> {
                    if (to == StockLocation.SHOP) {
                        f.deliveriesIn = f.deliveriesIn.add(quantity);
                    }
                }
                case TRANSFER -> {
                    if (to == StockLocation.SHOP) {
                        f.transfersIn = f.transfersIn.add(quantity);
                    } else if (from == StockLocation.SHOP) {
                        f.transfersOut = f.transfersOut.add(quantity);
                    }
                }
                case SPOILAGE -> {
                    if (from == StockLocation.SHOP) {
                        f.spoilageOut = f.spoilageOut.add(quantity);
                    }
                }
                default -> {
                    // sales are already part of the counted difference
                }
            }
        }
        return flows;
    }

    private DailyRecord findDay(Long dailyRecordId) {
        return dailyRecordRepository.findById(dailyRecordId)
                .orElseThrow(() -> new NotFoundException("Daily record", dailyRecordId));
    }

    private static class ShopFlows {
        BigDecimal deliveriesIn = BigDecimal.ZERO;
        BigDecimal transfersIn = BigDecimal.ZERO;
        BigDecimal transfersOut = BigDecimal.ZERO;
        BigDecimal spoilageOut = BigDecimal.ZERO;
    }
}
