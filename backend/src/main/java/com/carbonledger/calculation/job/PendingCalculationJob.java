package com.carbonledger.calculation.job;

import com.carbonledger.calculation.config.CalculationProperties;
import com.carbonledger.calculation.engine.CalculationSummary;
import com.carbonledger.calculation.engine.EmissionCalculationService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic streaming sweep over activities without results. Disabled unless
 * carbonledger.calculation.sweep.enabled=true. A running sweep stops at the next page boundary on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingCalculationJob {

    private final EmissionCalculationService emissionCalculationService;
    private final CalculationProperties calculationProperties;

    private final AtomicBoolean stopping = new AtomicBoolean(false);

    @Scheduled(
            fixedDelayString = "${carbonledger.calculation.sweep.interval-ms:300000}",
            initialDelayString = "${carbonledger.calculation.sweep.initial-delay-ms:60000}")
    public void runScheduled() {
        if (!calculationProperties.getSweep().isEnabled()) {
            return;
        }
        runSweep();
    }

    public CalculationSummary runSweep() {
        CalculationSummary summary = emissionCalculationService.calculateAllPending(
                calculationProperties.getBatchSize(), true, stopping::get,
                (partition, pageIndex, tracked, processed) -> log.debug(
                        "Sweep {} page {} committed ({} tracked, {} processed)", partition, pageIndex, tracked, processed));
        if (summary.totalActivities() > 0) {
            log.info("Pending calculation sweep: {} processed, {} errors", summary.totalProcessed(), summary.totalErrors());
        }
        return summary;
    }

    @PreDestroy
    void stop() {
        stopping.set(true);
    }
}
