package com.gastro.ledger.service;

import com.gastro.ledger.dto.ExpiryAlert;
import com.gastro.ledger.dto.ExpiryAlertReport;
import com.gastro.ledger.model.AlertLevel;
import com.gastro.ledger.model.IngredientBatch;
import com.gastro.ledger.repository.IngredientBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ExpiryMonitorService {

    static final int CRITICAL_DAYS = 2;
    static final int WARNING_DAYS = 6;

    private final IngredientBatchRepository batchRepository;
    private final Clock clock;

    public ExpiryMonitorService(IngredientBatchRepository batchRepository, Clock clock) {
        this.batchRepository = batchRepository;
        this.clock = clock;
    }

    /** Null when the batch has no expiry date. */
    public Long daysUntilExpiry(LocalDate expiryDate) {
        if (expiryDate == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(LocalDate.now(clock), expiryDate);
    }

    public AlertLevel alertLevel(Long daysUntilExpiry) {
        if (daysUntilExpiry == null) {
            return AlertLevel.NONE;
        }
        if (daysUntilExpiry < 0) {
            return AlertLevel.EXPIRED;
        }
        if (daysUntilExpiry <= CRITICAL_DAYS) {
            return AlertLevel.CRITICAL;
        }
        if (daysUntilExpiry <= WARNING_DAYS) {
            return AlertLevel.WARNING;
        }
        return AlertLevel.NONE;
    }

    @Transactional(readOnly = true)
    public ExpiryAlertReport alertsForActiveBatches() {
        List<ExpiryAlert> alerts = batchRepository.findActiveWithExpiry().stream()
                .map(this::toAlert)
                .filter(alert -> alert.alertLevel() != AlertLevel.NONE)
                .sorted(Comparator.comparing(ExpiryAlert::expiryDate).thenComparing(ExpiryAlert::batchNumber))
                .collect(Collectors.toList());

        int expired = count(alerts, AlertLevel.EXPIRED);
        int critical = count(alerts, AlertLevel.CRITICAL);
        int warning = count(alerts, AlertLevel.WARNING);
        return new ExpiryAlertReport(alerts, alerts.size(), expired, critical, warning);
    }

    @Scheduled(cron = "${ledger.expiry.scan-cron:0 0 6 * * *}")
    public void scanAndLog() {
        ExpiryAlertReport report = alertsForActiveBatches();
        if (report.expiredCount() == 0 && report.criticalCount() == 0) {
            log.info("Expiry scan: {} batch(es) within the warning window, none expired or critical",
                    report.warningCount());
            return;
        }
        log.warn("Expiry scan: {} expired and {} critical batch(es)", report.expiredCount(),
                report.criticalCount());
        report.alerts().stream()
                .filter(alert -> alert.alertLevel() == AlertLevel.EXPIRED
                        || alert.alertLevel() == AlertLevel.CRITICAL)
                .forEach(alert -> log.warn("  {} {} of {} at {} expires {} ({})", alert.batchNumber(),
                        alert.remainingQuantity().toPlainString(), alert.ingredientName(), alert.location(),
                        alert.expiryDate(), alert.alertLevel()));
    }

    private ExpiryAlert toAlert(IngredientBatch batch) {
        long days = daysUntilExpiry(batch.getExpiryDate());
        return new ExpiryAlert(batch.getId(), batch.getBatchNumber(), batch.getIngredient().getId(),
                batch.getIngredient().getName(), batch.getIngredient().getUnitLabel(), batch.getLocation(),
                batch.getExpiryDate(), batch.getRemainingQuantity(), days, alertLevel(days));
    }

    private static int count(List<ExpiryAlert> alerts, AlertLevel level) {
        return (int) alerts.stream().filter(alert -> alert.alertLevel() == level).count();
    }
}
