package com.gastro.ledger.service;

import com.gastro.ledger.dto.BatchResponse;
import com.gastro.ledger.dto.ConsumptionResult;
import com.gastro.ledger.dto.IngredientStockSummary;
import com.gastro.ledger.exception.InsufficientStockException;
import com.gastro.ledger.exception.NotFoundException;
import com.gastro.ledger.exception.ValidationException;
import com.gastro.ledger.model.*;
import com.gastro.ledger.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class StockLedgerServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Warsaw");
    private static final LocalDate TODAY = LocalDate.of(2026, 1, 5);

    @Mock
    private IngredientRepository ingredientRepository;
    @Mock
    private IngredientBatchRepository batchRepository;
    @Mock
    private StockMovementRepository movementRepository;
    @Mock
    private BatchDeductionRepository deductionRepository;
    @Mock
    private DailyRecordRepository dailyRecordRepository;
    @Mock
    private AuditService auditService;

    private StockLedgerService stockLedgerService;
    private Ingredient meat;
    private DailyRecord openDay;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(ZonedDateTime.of(TODAY.atTime(10, 0), ZONE).toInstant(), ZONE);
        stockLedgerService = new StockLedgerService(ingredientRepository, batchRepository, movementRepository,
                deductionRepository, dailyRecordRepository, new ExpiryMonitorService(batchRepository, clock),
                auditService, clock);

        meat = new Ingredient();
        meat.setId(1L);
        meat.setName("Kebab meat");
        meat.setUnitType(UnitType.WEIGHT);
        meat.setUnitLabel("kg");

        openDay = new DailyRecord();
        openDay.setId(7L);
        openDay.setDate(TODAY);
        openDay.markOpen(TODAY.atTime(8, 0));

        when(ingredientRepository.findById(1L)).thenReturn(Optional.of(meat));
        when(dailyRecordRepository.findByStatusForShare(DayStatus.OPEN)).thenReturn(Optional.of(openDay));
        when(batchRepository.findBatchNumbersStartingWith(anyString())).thenReturn(new ArrayList<>());
        when(batchRepository.save(any(IngredientBatch.class))).thenAnswer(i -> i.getArgument(0));
        when(batchRepository.saveAndFlush(any(IngredientBatch.class))).thenAnswer(i -> i.getArgument(0));
        when(movementRepository.save(any(StockMovement.class))).thenAnswer(i -> {
            StockMovement m = i.getArgument(0);
            m.setId(99L);
            return m;
        });
    }

    private IngredientBatch batch(long id, StockLocation location, LocalDate expiry, String remaining) {
        IngredientBatch batch = new IngredientBatch();
        batch.setId(id);
        batch.setBatchNumber("B-20260101-00" + id);
        batch.setIngredient(meat);
        batch.setLocation(location);
        batch.setExpiryDate(expiry);
        batch.setCreatedAt(LocalDateTime.of(2026, 1, 1, 8, 0).plusMinutes(id));
        batch.setInitialQuantity(new BigDecimal(remaining));
        batch.setRemainingQuantity(new BigDecimal(remaining));
        return batch;
    }

    @Test
    void applyDelivery_createsOneBatchWithDailySequence() {
        when(batchRepository.findBatchNumbersStartingWith("B-20260105-"))
                .thenReturn(List.of("B-20260105-001", "B-20260105-002"));

        BatchResponse batch = stockLedgerService.applyDelivery(1L, new BigDecimal("5.0"), StockLocation.SHOP,
                TODAY.plusDays(4), "Supplier A");

        assertEquals("B-20260105-003", batch.batchNumber());
        assertEquals(new BigDecimal("5.000"), batch.remainingQuantity());
        assertEquals(StockLocation.SHOP, batch.location());
        verify(batchRepository, times(1)).saveAndFlush(any(IngredientBatch.class));

        ArgumentCaptor<StockMovement> movement = ArgumentCaptor.forClass(StockMovement.class);
        verify(movementRepository).save(movement.capture());
        assertEquals(MovementType.DELIVERY, movement.getValue().getMovementType());
        assertEquals(StockLocation.SHOP, movement.getValue().getToLocation());
        assertSame(openDay, movement.getValue().getDailyRecord());
    }

    @Test
    void applyDelivery_stampsBatchAndMovementWithLedgerClock() {
        stockLedgerService.applyDelivery(1L, new BigDecimal("1.0"), StockLocation.STORAGE, null, null);

        ArgumentCaptor<IngredientBatch> batch = ArgumentCaptor.forClass(IngredientBatch.class);
        verify(batchRepository).saveAndFlush(batch.capture());
        assertEquals(TODAY.atTime(10, 0), batch.getValue().getCreatedAt());

        ArgumentCaptor<StockMovement> movement = ArgumentCaptor.forClass(StockMovement.class);
        verify(movementRepository).save(movement.capture());
        assertEquals(TODAY.atTime(10, 0), movement.getValue().getCreatedAt());
    }

    @Test
    void applySpoilage_stampsDeductionsWithLedgerClock() {
        IngredientBatch shop = batch(1, StockLocation.SHOP, TODAY.plusDays(1), "2.000");
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.SHOP)).thenReturn(List.of(shop));

        stockLedgerService.applySpoilage(1L, new BigDecimal("0.5"), SpoilageReason.OTHER, null, null);

        ArgumentCaptor<BatchDeduction> deduction = ArgumentCaptor.forClass(BatchDeduction.class);
        verify(deductionRepository).save(deduction.capture());
        assertEquals(TODAY.atTime(10, 0), deduction.getValue().getCreatedAt());
    }

    @Test
    void applyDelivery_dayClosedMeanwhileAttachesToNoDay() {
        openDay.markClosed(TODAY.atTime(9, 59));

        stockLedgerService.applyDelivery(1L, new BigDecimal("2.0"), StockLocation.SHOP, null, null);

        ArgumentCaptor<StockMovement> movement = ArgumentCaptor.forClass(StockMovement.class);
        verify(movementRepository).save(movement.capture());
        assertNull(movement.getValue().getDailyRecord());
        verify(dailyRecordRepository, never()).findFirstByStatus(any());
    }

    @Test
    void applySpoilage_locksTheOpenDayBeforeDrawingStock() {
        IngredientBatch shop = batch(1, StockLocation.SHOP, TODAY.plusDays(1), "2.000");
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.SHOP)).thenReturn(List.of(shop));

        stockLedgerService.applySpoilage(1L, new BigDecimal("0.5"), SpoilageReason.OTHER, null, null);

        InOrder order = inOrder(dailyRecordRepository, batchRepository);
        order.verify(dailyRecordRepository).findByStatusForShare(DayStatus.OPEN);
        order.verify(batchRepository).findEligibleForUpdate(1L, StockLocation.SHOP);
    }

    @Test
    void applyDelivery_rejectsNonPositiveQuantity() {
        assertThrows(ValidationException.class,
                () -> stockLedgerService.applyDelivery(1L, BigDecimal.ZERO, StockLocation.STORAGE, null, null));
        verify(batchRepository, never()).saveAndFlush(any());
    }

    @Test
    void applyDelivery_unknownIngredient() {
        when(ingredientRepository.findById(42L)).thenReturn(Optional.empty());
        assertThrows(NotFoundException.class,
                () -> stockLedgerService.applyDelivery(42L, BigDecimal.ONE, StockLocation.STORAGE, null, null));
    }

    @Test
    void consumeForSale_drawsOnlyFromSoonestExpiringBatch() {
        IngredientBatch e1 = batch(1, StockLocation.SHOP, TODAY.plusDays(1), "2.000");
        IngredientBatch e2 = batch(2, StockLocation.SHOP, TODAY.plusDays(2), "2.000");
        IngredientBatch e3 = batch(3, StockLocation.SHOP, TODAY.plusDays(3), "2.000");
        // repository hands them back in id order, not FIFO order
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.SHOP)).thenReturn(List.of(e3, e2, e1));

        ConsumptionResult result = stockLedgerService.consumeForSale(1L, new BigDecimal("1.500"),
                StockLocation.SHOP);

        assertEquals(0, new BigDecimal("0.500").compareTo(e1.getRemainingQuantity()));
        assertEquals(0, new BigDecimal("2.000").compareTo(e2.getRemainingQuantity()));
        assertEquals(0, new BigDecimal("2.000").compareTo(e3.getRemainingQuantity()));
        assertEquals(1, result.consumedBatches().size());
        assertEquals(1L, result.consumedBatches().get(0).batchId());
        verify(deductionRepository, times(1)).save(any(BatchDeduction.class));
    }

    @Test
    void consumeForSale_spansBatchesAndRetiresEmptiedOnes() {
        IngredientBatch first = batch(1, StockLocation.SHOP, TODAY.plusDays(1), "1.000");
        IngredientBatch noExpiry = batch(2, StockLocation.SHOP, null, "5.000");
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.SHOP)).thenReturn(List.of(noExpiry, first));

        ConsumptionResult result = stockLedgerService.consumeForSale(1L, new BigDecimal("1.250"),
                StockLocation.SHOP);

        assertFalse(first.isActive());
        assertEquals(0, first.getRemainingQuantity().signum());
        assertEquals(0, new BigDecimal("4.750").compareTo(noExpiry.getRemainingQuantity()));
        assertEquals(2, result.consumedBatches().size());
        assertTrue(result.consumedBatches().get(0).retired());
        verify(deductionRepository, times(2)).save(any(BatchDeduction.class));
    }

    @Test
    void consumeForSale_insufficientStockMutatesNothing() {
        IngredientBatch only = batch(1, StockLocation.SHOP, TODAY.plusDays(1), "1.000");
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.SHOP)).thenReturn(List.of(only));

        InsufficientStockException ex = assertThrows(InsufficientStockException.class,
                () -> stockLedgerService.consumeForSale(1L, new BigDecimal("1.001"), StockLocation.SHOP));

        assertEquals(0, new BigDecimal("1.000").compareTo(ex.getAvailable()));
        assertEquals(0, new BigDecimal("1.000").compareTo(only.getRemainingQuantity()));
        assertTrue(only.isActive());
        verify(batchRepository, never()).save(any());
        verify(batchRepository, never()).saveAndFlush(any());
        verify(movementRepository, never()).save(any());
        verify(deductionRepository, never()).save(any());
    }

    @Test
    void applyTransfer_createsDestinationBatchPerPortionKeepingExpiry() {
        IngredientBatch early = batch(1, StockLocation.STORAGE, TODAY.plusDays(2), "1.000");
        IngredientBatch late = batch(2, StockLocation.STORAGE, TODAY.plusDays(8), "3.000");
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.STORAGE)).thenReturn(List.of(late, early));

        ConsumptionResult result = stockLedgerService.applyTransfer(1L, new BigDecimal("2"), StockLocation.STORAGE,
                StockLocation.SHOP);

        assertEquals(2, result.createdBatches().size());
        BatchResponse fromEarly = result.createdBatches().get(0);
        BatchResponse fromLate = result.createdBatches().get(1);
        assertEquals(StockLocation.SHOP, fromEarly.location());
        assertEquals(TODAY.plusDays(2), fromEarly.expiryDate());
        assertEquals(0, BigDecimal.ONE.compareTo(fromEarly.initialQuantity()));
        assertEquals(TODAY.plusDays(8), fromLate.expiryDate());
        assertEquals(0, BigDecimal.ONE.compareTo(fromLate.initialQuantity()));
        assertNotEquals(fromEarly.batchNumber(), fromLate.batchNumber());
        assertEquals(0, new BigDecimal("2.000").compareTo(late.getRemainingQuantity()));
    }

    @Test
    void applyTransfer_sameLocationRejected() {
        assertThrows(ValidationException.class, () -> stockLedgerService.applyTransfer(1L, BigDecimal.ONE,
                StockLocation.SHOP, StockLocation.SHOP));
    }

    @Test
    void applySpoilage_recordsReasonAndDrawsFromShop() {
        IngredientBatch shop = batch(1, StockLocation.SHOP, TODAY.plusDays(1), "2.000");
        when(batchRepository.findEligibleForUpdate(1L, StockLocation.SHOP)).thenReturn(List.of(shop));

        stockLedgerService.applySpoilage(1L, new BigDecimal("0.5"), SpoilageReason.EXPIRED, null, "Smell");

        ArgumentCaptor<StockMovement> movement = ArgumentCaptor.forClass(StockMovement.class);
        verify(movementRepository).save(movement.capture());
        assertEquals(MovementType.SPOILAGE, movement.getValue().getMovementType());
        assertEquals(SpoilageReason.EXPIRED, movement.getValue().getSpoilageReason());
        assertEquals(StockLocation.SHOP, movement.getValue().getFromLocation());
        assertEquals(0, new BigDecimal("1.500").compareTo(shop.getRemainingQuantity()));
    }

    @Test
    void getIngredientStock_summarisesInFifoOrderWithAlerts() {
        IngredientBatch later = batch(1, StockLocation.SHOP, TODAY.plusDays(10), "2.000");
        IngredientBatch soon = batch(2, StockLocation.SHOP, TODAY.plusDays(1), "0.500");
        when(batchRepository.findForIngredient(1L, StockLocation.SHOP, true)).thenReturn(List.of(later, soon));

        IngredientStockSummary summary = stockLedgerService.getIngredientStock(1L, StockLocation.SHOP);

        assertEquals(0, new BigDecimal("2.500").compareTo(summary.totalQuantity()));
        assertEquals(2, summary.activeBatchCount());
        assertEquals(1, summary.expiringSoonCount());
        assertEquals(2L, summary.batches().get(0).batchId());
        assertEquals(1, summary.batches().get(0).fifoOrder());
        assertEquals(AlertLevel.CRITICAL, summary.batches().get(0).alertLevel());
        assertEquals(AlertLevel.NONE, summary.batches().get(1).alertLevel());
    }
}
