package com.gastro.ledger.service;

import com.gastro.ledger.dto.MissingSaleSuggestion;
import com.gastro.ledger.dto.ProductReconciliation;
import com.gastro.ledger.dto.ReconciliationReport;
import com.gastro.ledger.dto.SharedPrimaryIngredient;
import com.gastro.ledger.dto.UsageItem;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.model.DailyRecord;
import com.gastro.ledger.model.Ingredient;
import com.gastro.ledger.model.ProductVariant;
import com.gastro.ledger.model.RecipeLine;
import com.gastro.ledger.repository.DailyRecordRepository;
import com.gastro.ledger.repository.ProductVariantRepository;
import com.gastro.ledger.repository.RecordedSaleRepository;
import com.gastro.ledger.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Compares what the till recorded with what the day's ingredient usage says
 * was sold. Only variants whose primary ingredient belongs to them alone are
 * attributed; a primary ingredient shared by several active variants is
 * reported as excluded rather than split.
 */
@Slf4j
@Service
public class SalesReconciliationService {

    static final BigDecimal CRITICAL_PERCENT = new BigDecimal("30");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final DailyRecordRepository dailyRecordRepository;
    private final RecordedSaleRepository recordedSaleRepository;
    private final ProductVariantRepository variantRepository;
    private final ClosingCalculatorService closingCalculatorService;
    private final SettingsService settingsService;

    public SalesReconciliationService(DailyRecordRepository dailyRecordRepository,
            RecordedSaleRepository recordedSaleRepository,
            ProductVariantRepository variantRepository,
            ClosingCalculatorService closingCalculatorService,
            SettingsService settingsService) {
        this.dailyRecordRepository = dailyRecordRepository;
        this.recordedSaleRepository = recordedSaleRepository;
        this.variantRepository = variantRepository;
        this.closingCalculatorService = closingCalculatorService;
        this.settingsService = settingsService;
    }

    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(Long dailyRecordId) {
        DailyRecord day = dailyRecordRepository.findById(dailyRecordId)
                .orElseThrow(() -> new NotFoundException("Daily record", dailyRecordId));

        Map<Long, RecordedFigures> recorded = new HashMap<>();
        for (Object[] row : recordedSaleRepository.sumRecordedByVariant(dailyRecordId)) {
            recorded.put((Long) row[0], new RecordedFigures(Numbers.toBigDecimal(row[1]),
                    money(Numbers.toBigDecimal(row[2]))));
        }

        // An open day has no closing counts, hence no usage and nothing implied
        Map<Long, BigDecimal> usage = new HashMap<>();
        if (!day.isOpen()) {
            for (UsageItem item : closingCalculatorService.computeUsage(dailyRecordId)) {
                usage.put(item.ingredientId(), item.usage());
            }
        }

        List<ProductVariant> active = variantRepository.findActiveWithRecipe();
        Map<Long, List<ProductVariant>> byPrimary = new TreeMap<>();
        Map<Long, Ingredient> primaryIngredients = new HashMap<>();
        for (ProductVariant variant : active) {
            variant.getPrimaryLine().ifPresent(line -> {
                byPrimary.computeIfAbsent(line.getIngredient().getId(), id -> new ArrayList<>()).add(variant);
                primaryIngredients.put(line.getIngredient().getId(), line.getIngredient());
            });
        }

        List<SharedPrimaryIngredient> excluded = new ArrayList<>();
        byPrimary.forEach((ingredientId, variants) -> {
            if (variants.size() > 1) {
                excluded.add(new SharedPrimaryIngredient(ingredientId,
                        primaryIngredients.get(ingredientId).getName(),
                        variants.stream().map(ProductVariant::getId).sorted().collect(Collectors.toList())));
            }
        });

        Map<Long, ProductVariant> reported = new LinkedHashMap<>();
        active.forEach(v -> reported.put(v.getId(), v));
        Set<Long> retired = recorded.keySet().stream()
                .filter(id -> !reported.containsKey(id))
                .collect(Collectors.toSet());
        if (!retired.isEmpty()) {
            variantRepository.findWithProductByIdIn(retired).forEach(v -> reported.put(v.getId(), v));
        }

        List<ProductReconciliation> byProduct = new ArrayList<>();
        for (ProductVariant variant : reported.values()) {
            RecordedFigures figures = recorded.getOrDefault(variant.getId(), RecordedFigures.NONE);
            RecipeLine primary = variant.isActive() ? variant.getPrimaryLine().orElse(null) : null;
            boolean attributable = primary != null
                    && byPrimary.get(primary.getIngredient().getId()).size() == 1;

            BigDecimal calculatedQty = attributable
                    ? impliedQuantity(primary, usage.get(primary.getIngredient().getId()))
                    : BigDecimal.ZERO;
            BigDecimal calculatedRevenue = money(calculatedQty.multiply(variant.getPrice()));

            byProduct.add(new ProductReconciliation(variant.getId(), variant.getDisplayName(), variant.getPrice(),
                    attributable, figures.quantity, figures.revenue, calculatedQty, calculatedRevenue,
                    figures.quantity.subtract(calculatedQty), figures.revenue.subtract(calculatedRevenue)));
        }
        byProduct.sort(Comparator.comparing(ProductReconciliation::revenueDifference).reversed()
                .thenComparing(ProductReconciliation::variantId));

        BigDecimal recordedTotal = money(recorded.values().stream()
                .map(f -> f.revenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        BigDecimal calculatedTotal = money(byProduct.stream()
                .map(ProductReconciliation::calculatedRevenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        BigDecimal discrepancy = recordedTotal.subtract(calculatedTotal);
        BigDecimal discrepancyPercent = calculatedTotal.signum() == 0
                ? null
                : discrepancy.abs().multiply(HUNDRED).divide(calculatedTotal, 2, RoundingMode.HALF_UP);
        // compared unrounded: |d| * 100 > 30 * calculated
        boolean critical = discrepancyPercent != null && discrepancy.abs().multiply(HUNDRED)
                .compareTo(CRITICAL_PERCENT.multiply(calculatedTotal)) > 0;

        List<MissingSaleSuggestion> suggestions = suggestionsFor(byProduct, settingsService.getMaxSuggestions());

        if (critical) {
            log.warn("Day {}: recorded {} vs calculated {} ({}% off)", day.getDate(), recordedTotal.toPlainString(),
                    calculatedTotal.toPlainString(), discrepancyPercent.toPlainString());
        } else {
            log.debug("Day {}: recorded {} vs calculated {}", day.getDate(), recordedTotal.toPlainString(),
                    calculatedTotal.toPlainString());
        }

        return new ReconciliationReport(day.getId(), day.getStatus(), settingsService.getCurrencyLabel(),
                recordedTotal, calculatedTotal, discrepancy, discrepancyPercent, critical, recorded.isEmpty(),
                byProduct, suggestions, excluded);
    }

    /**
     * Quantity sold implied by the usage of a primary ingredient, rounded up
     * to the ingredient's granularity. Zero when nothing (or less than nothing) was used.
     */
    static BigDecimal impliedQuantity(RecipeLine primary, BigDecimal usage) {
        if (usage == null || usage.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal raw = usage.divide(primary.getQuantityPerUnit(), MathContext.DECIMAL64);
        return primary.getIngredient().getUnitType().roundImplied(raw);
    }

    private static List<MissingSaleSuggestion> suggestionsFor(List<ProductReconciliation> byProduct, int limit) {
        return byProduct.stream()
                .filter(ProductReconciliation::attributable)
                .filter(p -> p.calculatedQty().compareTo(p.recordedQty()) > 0)
                .map(p -> {
                    BigDecimal missing = p.calculatedQty().subtract(p.recordedQty());
                    return new MissingSaleSuggestion(p.variantId(), p.productName(), missing,
                            money(missing.multiply(p.price())),
                            String.format("Ingredient usage implies %s sold, %s recorded",
                                    p.calculatedQty().toPlainString(), p.recordedQty().toPlainString()));
                })
                .sorted(Comparator.comparing(MissingSaleSuggestion::estimatedValue).reversed()
                        .thenComparing(MissingSaleSuggestion::variantId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static final class RecordedFigures {
        static final RecordedFigures NONE = new RecordedFigures(BigDecimal.ZERO, BigDecimal.ZERO.setScale(2));

        final BigDecimal quantity;
        final BigDecimal revenue;

        RecordedFigures(BigDecimal quantity, BigDecimal revenue) {
            this.quantity = quantity;
            this.revenue = revenue;
        }
    }
}
