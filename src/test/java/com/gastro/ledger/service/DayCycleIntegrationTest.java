package com.gastro.ledger.service;

import com.gastro.ledger.dto.*;
import com.gastro.ledger.exception.InsufficientStockException;
import com.gastro.ledger.exception.StateException;
import com.gastro.ledger.model.SpoilageReason;
import com.gastro.ledger.model.StockLocation;
import com.gastro.ledger.model.UnitType;
import com.gastro.ledger.model.VoidReason;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@SpringBootTest
@Transactional
public class DayCycleIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2026, 1, 5);

    @Autowired
    private CatalogService catalogService;
    @Autowired
    private StockLedgerService stockLedgerService;
    @Autowired
    private DailyRecordService dailyRecordService;
    @Autowired
    private RecordedSaleService recordedSaleService;
    @Autowired
    private ClosingCalculatorService closingCalculatorService;
    @Autowired
    private SalesReconciliationService reconciliationService;
    @Autowired
    private SettingsService settingsService;

    @MockBean
    private AuditService auditService; // keep audit rows out of the way

    private IngredientResponse ingredient(String name, UnitType type) {
        IngredientRequest request = new IngredientRequest();
        request.setName(name);
        request.setUnitType(type);
        return catalogService.createIngredient(request);
    }

    private VariantResponse kebabInPita(IngredientResponse meat, IngredientResponse pita) {
        VariantRequest request = new VariantRequest();
        request.setProductName("Kebab in pita");
        request.setPrice(new BigDecimal("28.00"));
        VariantRequest.RecipeLineRequest meatLine = new VariantRequest.RecipeLineRequest();
        meatLine.setIngredientId(meat.id());
        meatLine.setQuantityPerUnit(new BigDecimal("0.150"));
        VariantRequest.RecipeLineRequest pitaLine = new VariantRequest.RecipeLineRequest();
        pitaLine.setIngredientId(pita.id());
        pitaLine.setQuantityPerUnit(BigDecimal.ONE);
        pitaLine.setPrimary(true);
        request.getRecipe().add(meatLine);
        request.getRecipe().add(pitaLine);
        return catalogService.createVariant(request);
    }

    @Test
    public void testFullDayReconciles() {
        // 1. Catalog and stock on hand before the day opens
        IngredientResponse meat = ingredient("Kebab meat", UnitType.WEIGHT);
        IngredientResponse pita = ingredient("Pita bread", UnitType.COUNT);
        VariantResponse kebab = kebabInPita(meat, pita);
        stockLedgerService.applyDelivery(meat.id(), new BigDecimal("10.5"), StockLocation.SHOP, DAY.plusDays(3),
                null);
        stockLedgerService.applyDelivery(pita.id(), new BigDecimal("50"), StockLocation.STORAGE, null, null);

        // 2. Open with shop counts
        DailyRecordResponse day = dailyRecordService.openDay(DAY, List.of(
                new SnapshotEntry(meat.id(), new BigDecimal("10.5")),
                new SnapshotEntry(pita.id(), BigDecimal.ZERO)), "Test day");
        Assertions.assertEquals(2, day.snapshots().size());

        // 3. Movements during the day
        stockLedgerService.applyTransfer(pita.id(), new BigDecimal("20"), StockLocation.STORAGE, StockLocation.SHOP);
        stockLedgerService.applyDelivery(meat.id(), new BigDecimal("5.0"), StockLocation.SHOP, DAY.plusDays(4),
                null);
        stockLedgerService.applySpoilage(meat.id(), new BigDecimal("0.5"), SpoilageReason.OTHER,
                StockLocation.SHOP, null);

        // 4. Ten sales stand, one is voided
        for (int i = 0; i < 10; i++) {
            recordedSaleService.record(day.id(), kebab.id(), 1, null);
        }
        RecordedSaleResponse mistake = recordedSaleService.record(day.id(), kebab.id(), 1, null);
        recordedSaleService.voidSale(mistake.id(), VoidReason.ENTRY_ERROR, null);

        DayTotals totals = recordedSaleService.getDayTotals(day.id());
        Assertions.assertEquals(new BigDecimal("280.00"), totals.totalRevenue());
        Assertions.assertEquals(10, totals.salesCount());
        Assertions.assertEquals(11, recordedSaleService.getDaySales(day.id(), true).size());

        // 5. Close
        ClosingResult closing = dailyRecordService.closeDay(day.id(), List.of(
                new SnapshotEntry(meat.id(), new BigDecimal("13.5")),
                new SnapshotEntry(pita.id(), new BigDecimal("8"))), null);

        UsageItem meatUsage = closing.usage().stream()
                .filter(u -> u.ingredientId().equals(meat.id())).findFirst().orElseThrow();
        Assertions.assertEquals(0, new BigDecimal("1.5").compareTo(meatUsage.usage()));
        Assertions.assertEquals(0, new BigDecimal("0.5").compareTo(meatUsage.spoilageOut()));
        UsageItem pitaUsage = closing.usage().stream()
                .filter(u -> u.ingredientId().equals(pita.id())).findFirst().orElseThrow();
        Assertions.assertEquals(0, new BigDecimal("12").compareTo(pitaUsage.usage()));
        Assertions.assertEquals(0, new BigDecimal("20").compareTo(pitaUsage.transfersIn()));
        Assertions.assertTrue(closing.alerts().stream().anyMatch(a -> a.ingredientId().equals(pita.id())));
        Assertions.assertEquals(closing.usage(), closingCalculatorService.computeUsage(day.id()));

        // 6. Reconcile
        ReconciliationReport report = reconciliationService.reconcile(day.id());
        Assertions.assertEquals(new BigDecimal("280.00"), report.recordedTotal());
        Assertions.assertEquals(new BigDecimal("336.00"), report.calculatedTotal());
        Assertions.assertEquals(new BigDecimal("-56.00"), report.discrepancy());
        Assertions.assertEquals(new BigDecimal("16.67"), report.discrepancyPercent());
        Assertions.assertFalse(report.hasCriticalDiscrepancy());
        Assertions.assertEquals(1, report.suggestions().size());
        Assertions.assertEquals(0, new BigDecimal("2").compareTo(report.suggestions().get(0).suggestedQty()));
    }

    @Test
    public void testClosedDayRejectsSalesAndVoids() {
        IngredientResponse pita = ingredient("Pita bread", UnitType.COUNT);
        IngredientResponse meat = ingredient("Kebab meat", UnitType.WEIGHT);
        VariantResponse kebab = kebabInPita(meat, pita);
        List<SnapshotEntry> counts = List.of(new SnapshotEntry(meat.id(), BigDecimal.ONE),
                new SnapshotEntry(pita.id(), BigDecimal.TEN));

        DailyRecordResponse day = dailyRecordService.openDay(DAY, counts, null);
        RecordedSaleResponse sale = recordedSaleService.record(day.id(), kebab.id(), 1, null);
        dailyRecordService.closeDay(day.id(), counts, null);

        StateException record = Assertions.assertThrows(StateException.class,
                () -> recordedSaleService.record(day.id(), kebab.id(), 1, null));
        Assertions.assertEquals(StateException.DAY_NOT_OPEN, record.getErrorCode());
        StateException voided = Assertions.assertThrows(StateException.class,
                () -> recordedSaleService.voidSale(sale.id(), VoidReason.OTHER, null));
        Assertions.assertEquals(StateException.DAY_CLOSED, voided.getErrorCode());
    }

    @Test
    public void testRealtimeDepletionDrawsShopStock() {
        IngredientResponse meat = ingredient("Kebab meat", UnitType.WEIGHT);
        IngredientResponse pita = ingredient("Pita bread", UnitType.COUNT);
        VariantResponse kebab = kebabInPita(meat, pita);
        stockLedgerService.applyDelivery(meat.id(), new BigDecimal("1.0"), StockLocation.SHOP, DAY.plusDays(2), null);
        stockLedgerService.applyDelivery(pita.id(), new BigDecimal("2"), StockLocation.SHOP, null, null);
        settingsService.updateSetting(SettingsService.KEY_REALTIME_DEPLETION, "true");

        DailyRecordResponse day = dailyRecordService.openDay(DAY, List.of(
                new SnapshotEntry(meat.id(), BigDecimal.ONE),
                new SnapshotEntry(pita.id(), new BigDecimal("2"))), null);
        recordedSaleService.record(day.id(), kebab.id(), 2, null);

        IngredientStockSummary meatStock = stockLedgerService.getIngredientStock(meat.id(), StockLocation.SHOP);
        Assertions.assertEquals(0, new BigDecimal("0.700").compareTo(meatStock.totalQuantity()));
        IngredientStockSummary pitaStock = stockLedgerService.getIngredientStock(pita.id(), StockLocation.SHOP);
        Assertions.assertEquals(0, pitaStock.totalQuantity().signum());

        Assertions.assertThrows(InsufficientStockException.class,
                () -> recordedSaleService.record(day.id(), kebab.id(), 1, null));
    }
}
