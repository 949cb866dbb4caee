package com.carbonledger.calculation.engine;

import com.carbonledger.activity.ActivityLookup;
import com.carbonledger.calculation.calculator.ActivityCalculator;
import com.carbonledger.calculation.calculator.CalculationOutcome;
import com.carbonledger.calculation.config.CalculationProperties;
import com.carbonledger.domain.ActivityRecord;
import com.carbonledger.domain.ActivityRef;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionResult;
import com.carbonledger.domain.EmissionResultRepository;
import com.carbonledger.domain.EmissionResultsChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Routes activities to their calculator and persists results, keeping at most one live result per activity.
 * <p>
 * Modes: single (idempotent, returns the existing result when present), batch (one transaction; fail-fast
 * batches are all-or-nothing), recalculation (delete then calculate in one transaction), and full-population
 * sweeps. The streaming sweep pages through each activity type by offset, commits per page and drops the page
 * before fetching the next, so memory stays bounded by the page size. The in-memory sweep loads up to
 * legacyMaxRecords per type and is meant for small datasets only.
 * <p>
 * Single, batch and recalculation calls publish one {@link EmissionResultsChangedEvent} per commit; a sweep
 * collects the dates of all its committed pages and publishes once when it ends or is cancelled.
 */
@Service
@Slf4j
public class EmissionCalculationService {

    private final Map<ActivityType, ActivityCalculator<? extends ActivityRecord>> calculators =
            new EnumMap<>(ActivityType.class);
    private final EmissionResultRepository emissionResultRepository;
    private final ActivityLookup activityLookup;
    private final TransactionOperations transactionOperations;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final int fuzzyThreshold;
    private final int errorSampleSize;
    private final int legacyMaxRecords;

    public EmissionCalculationService(List<ActivityCalculator<? extends ActivityRecord>> calculators,
                                      EmissionResultRepository emissionResultRepository,
                                      ActivityLookup activityLookup,
                                      TransactionOperations transactionOperations,
                                      ApplicationEventPublisher applicationEventPublisher,
                                      CalculationProperties calculationProperties) {
        for (ActivityCalculator<? extends ActivityRecord> calculator : calculators) {
            ActivityCalculator<? extends ActivityRecord> previous = this.calculators.put(calculator.supportedType(), calculator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate calculator for activity type " + calculator.supportedType());
            }
        }
        if (calculationProperties.getFuzzyThreshold() < 0 || calculationProperties.getFuzzyThreshold() > 100) {
            throw new IllegalArgumentException("Fuzzy threshold must be within 0..100: " + calculationProperties.getFuzzyThreshold());
        }
        this.emissionResultRepository = emissionResultRepository;
        this.activityLookup = activityLookup;
        this.transactionOperations = transactionOperations;
        this.applicationEventPublisher = applicationEventPublisher;
        this.fuzzyThreshold = calculationProperties.getFuzzyThreshold();
        this.errorSampleSize = calculationProperties.getErrorSampleSize();
        this.legacyMaxRecords = calculationProperties.getLegacyMaxRecords();
    }

    public int getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public Optional<EmissionResult> calculateSingle(ActivityRecord activity) {
        return calculateSingle(activity, fuzzyThreshold, false, false);
    }

    /**
     * Calculate one activity. Unless skipDuplicateCheck, an existing result is returned unchanged.
     *
     * @param raiseOnError rethrow failures (wrapped in {@link EmissionCalculationException}) instead of
     *                     logging them and returning empty
     * @return the existing or new result; empty when not calculable or when a failure was not raised
     */
    public Optional<EmissionResult> calculateSingle(ActivityRecord activity, int threshold,
                                                    boolean raiseOnError, boolean skipDuplicateCheck) {
        ActivityRef ref = activity.ref();
        Attempt attempt;
        try {
            attempt = attempt(activity, threshold, skipDuplicateCheck);
        } catch (RuntimeException e) {
            if (raiseOnError) {
                throw wrap(ref, e);
            }
            log.error("Failed to calculate emissions for {} activity {}", ref.type(), ref.id(), e);
            return Optional.empty();
        }
        if (attempt.result() == null) {
            log.warn("{} activity {} not calculable: {}", ref.type(), ref.id(), attempt.failureReason());
            return Optional.empty();
        }
        if (attempt.created()) {
            publishChanged(Set.of(utcDate(attempt.result())));
        }
        return Optional.of(attempt.result());
    }

    public BatchCalculationResult calculateBatch(List<? extends ActivityRecord> activities) {
        return calculateBatch(activities, fuzzyThreshold, false);
    }

    /**
     * Calculate a batch in one transaction. Normal mode records per-activity failures and commits the successes;
     * fail-fast mode throws on the first failure (not calculable included) and rolls the whole batch back.
     * <p>
     * In normal mode a failed batch transaction is retried one activity per transaction. An activity that
     * gained a result in the meantime returns it; an activity whose own transaction fails is recorded as an error.
     */
    public BatchCalculationResult calculateBatch(List<? extends ActivityRecord> activities, int threshold,
                                                 boolean failFast) {
        log.info("Calculating batch of {} activities (failFast={})", activities.size(), failFast);
        BatchRun run;
        try {
            run = runInTransaction(activities, threshold, failFast);
        } catch (RuntimeException e) {
            if (failFast) {
                throw e;
            }
            log.warn("Batch transaction of {} activities failed, retrying one activity per transaction",
                    activities.size(), e);
            run = retryIndividually(activities, threshold);
        }
        publishChanged(run.affectedDates());
        CalculationSummary summary = run.statistics().toSummary(false);
        log.info("Batch complete: processed={}, errors={}, successRate={}",
                summary.totalProcessed(), summary.totalErrors(), summary.successRate());
        return new BatchCalculationResult(List.copyOf(run.results()), summary);
    }

    private BatchRun runInTransaction(List<? extends ActivityRecord> activities, int threshold, boolean failFast) {
        BatchRun run = BatchRun.empty();
        transactionOperations.executeWithoutResult(status -> {
            for (ActivityRecord activity : activities) {
                processOne(activity, threshold, failFast, false, run.statistics(), run.results(), run.affectedDates());
            }
        });
        return run;
    }

    private BatchRun retryIndividually(List<? extends ActivityRecord> activities, int threshold) {
        BatchRun combined = BatchRun.empty();
        for (ActivityRecord activity : activities) {
            try {
                combined.add(runInTransaction(List.of(activity), threshold, false));
            } catch (RuntimeException e) {
                log.error("Transaction failed for {} activity {}", activity.getActivityType(), activity.getId(), e);
                combined.statistics().recordError(new CalculationError(activity.getId(), activity.getActivityType(),
                        "Transaction failed: " + e.getMessage()));
            }
        }
        return combined;
    }

    /**
     * Delete the activity's results and calculate afresh in one transaction. A failure rolls back to the prior
     * result and is rethrown.
     */
    public Optional<EmissionResult> recalculate(ActivityRecord activity) {
        ActivityRef ref = activity.ref();
        Set<LocalDate> affectedDates = new HashSet<>();
        Optional<EmissionResult> result;
        try {
            result = transactionOperations.execute(status -> {
                List<EmissionResult> prior = emissionResultRepository.findByActivityTypeAndActivityId(ref.type(), ref.id());
                prior.forEach(r -> affectedDates.add(utcDate(r)));
                emissionResultRepository.deleteAll(prior);
                Attempt attempt = attempt(activity, fuzzyThreshold, true);
                if (attempt.result() == null) {
                    log.warn("Recalculation of {} activity {} removed {} result(s) and produced none: {}",
                            ref.type(), ref.id(), prior.size(), attempt.failureReason());
                    return Optional.<EmissionResult>empty();
                }
                affectedDates.add(utcDate(attempt.result()));
                return Optional.of(attempt.result());
            });
        } catch (RuntimeException e) {
            log.error("Recalculation failed for {} activity {}", ref.type(), ref.id(), e);
            throw wrap(ref, e);
        }
        publishChanged(affectedDates);
        return result == null ? Optional.empty() : result;
    }

    /**
     * Resolve the reference to an active activity, then calculate (or recalculate) it. Missing and
     * soft-deleted activities yield empty.
     */
    public Optional<EmissionResult> calculateByActivityRef(ActivityRef ref, boolean recalculate) {
        Optional<ActivityRecord> activity = activityLookup.findActive(ref);
        if (activity.isEmpty()) {
            log.warn("Activity {} not found or deleted", ref);
            return Optional.empty();
        }
        return recalculate ? recalculate(activity.get()) : calculateSingle(activity.get());
    }

    public CalculationSummary calculateAllPending(int batchSize, boolean streaming) {
        return calculateAllPending(batchSize, streaming, () -> false, SweepProgressCallback.NONE);
    }

    /**
     * Calculate every active activity that has no result. Cancellation is checked before each page.
     *
     * @param streaming true for the bounded-memory paged sweep, false for the in-memory sweep
     */
    public CalculationSummary calculateAllPending(int batchSize, boolean streaming, BooleanSupplier cancelled,
                                                  SweepProgressCallback progress) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        log.info("Starting {} sweep of pending activities (batchSize={})", streaming ? "streaming" : "in-memory", batchSize);
        CalculationStatistics sweep = new CalculationStatistics(errorSampleSize);
        Set<LocalDate> affectedDates = new HashSet<>();
        boolean wasCancelled;
        try {
            wasCancelled = streaming
                    ? streamPending(batchSize, sweep, affectedDates, cancelled, progress)
                    : loadPending(batchSize, sweep, affectedDates, cancelled, progress);
        } finally {
            publishChanged(affectedDates);
        }
        CalculationSummary summary = sweep.toSummary(wasCancelled);
        log.info("Sweep finished: processed={}, errors={}, successRate={}, totalCo2eTonnes={}, cancelled={}",
                summary.totalProcessed(), summary.totalErrors(), summary.successRate(),
                summary.totalCo2eTonnes(), wasCancelled);
        return summary;
    }

    private boolean streamPending(int pageSize, CalculationStatistics sweep, Set<LocalDate> affectedDates,
                                  BooleanSupplier cancelled, SweepProgressCallback progress) {
        for (ActivityType type : calculators.keySet()) {
            int pageIndex = 0;
            while (true) {
                if (cancelled.getAsBoolean()) {
                    log.info("Sweep cancelled before {} page {}", type, pageIndex);
                    return true;
                }
                List<ActivityRecord> page = new ArrayList<>(activityLookup.findActivePage(type, pageIndex, pageSize));
                if (page.isEmpty()) {
                    break;
                }
                int fetched = page.size();
                PageResult pageResult = processPage(type, page, true);
                sweep.merge(pageResult.statistics());
                progress.pageCommitted(type, pageIndex, pageResult.trackedRecords(), sweep.processed());
                affectedDates.addAll(pageResult.affectedDates());
                log.debug("Committed {} page {} ({} activities, processed so far {})",
                        type, pageIndex, fetched, sweep.processed());
                page.clear();
                if (fetched < pageSize) {
                    break;
                }
                pageIndex++;
            }
        }
        return false;
    }

    private boolean loadPending(int batchSize, CalculationStatistics sweep, Set<LocalDate> affectedDates,
                                BooleanSupplier cancelled, SweepProgressCallback progress) {
        log.warn("In-memory sweep loads up to {} records per activity type; use the streaming sweep for larger datasets",
                legacyMaxRecords);
        for (ActivityType type : calculators.keySet()) {
            Set<String> existingIds = new HashSet<>(emissionResultRepository.findActivityIdsWithResults(type, legacyMaxRecords));
            List<ActivityRecord> pending = activityLookup.findActivePage(type, 0, legacyMaxRecords).stream()
                    .filter(a -> !existingIds.contains(a.getId()))
                    .map(ActivityRecord.class::cast)
                    .toList();
            log.info("In-memory sweep: {} pending {} activities ({} with results)", pending.size(), type, existingIds.size());
            int pageIndex = 0;
            for (int from = 0; from < pending.size(); from += batchSize) {
                if (cancelled.getAsBoolean()) {
                    log.info("Sweep cancelled before {} chunk {}", type, pageIndex);
                    return true;
                }
                List<ActivityRecord> chunk = pending.subList(from, Math.min(from + batchSize, pending.size()));
                PageResult pageResult = processPage(type, chunk, false);
                sweep.merge(pageResult.statistics());
                progress.pageCommitted(type, pageIndex, existingIds.size() + pending.size(), sweep.processed());
                affectedDates.addAll(pageResult.affectedDates());
                pageIndex++;
            }
        }
        return false;
    }

    /**
     * One transaction per page. When the commit itself fails, nothing from the page persisted and every
     * activity of the page is recorded as failed.
     */
    private PageResult processPage(ActivityType type, List<ActivityRecord> page, boolean checkExisting) {
        CalculationStatistics pageStatistics = new CalculationStatistics(errorSampleSize);
        List<EmissionResult> created = new ArrayList<>();
        Set<LocalDate> affectedDates = new HashSet<>();
        try {
            transactionOperations.executeWithoutResult(status -> {
                for (ActivityRecord activity : page) {
                    if (checkExisting && emissionResultRepository.existsByActivityTypeAndActivityId(
                            activity.getActivityType(), activity.getId())) {
                        continue;
                    }
                    processOne(activity, fuzzyThreshold, false, true, pageStatistics, created, affectedDates);
                }
            });
        } catch (RuntimeException e) {
            log.error("Commit of {} page failed; {} activities recorded as errors", type, page.size(), e);
            CalculationStatistics failed = new CalculationStatistics(errorSampleSize);
            for (ActivityRecord activity : page) {
                failed.recordError(new CalculationError(activity.getId(), activity.getActivityType(),
                        "Page commit failed: " + e.getMessage()));
            }
            return new PageResult(failed, page.size(), Set.of());
        }
        int tracked = page.size() + created.size();
        created.clear();
        return new PageResult(pageStatistics, tracked, affectedDates);
    }

    private void processOne(ActivityRecord activity, int threshold, boolean failFast, boolean skipDuplicateCheck,
                            CalculationStatistics statistics, List<EmissionResult> results,
                            Set<LocalDate> affectedDates) {
        ActivityRef ref = activity.ref();
        Attempt attempt;
        try {
            attempt = attempt(activity, threshold, skipDuplicateCheck);
        } catch (RuntimeException e) {
            if (failFast) {
                throw wrap(ref, e);
            }
            log.error("Failed to calculate emissions for {} activity {}", ref.type(), ref.id(), e);
            statistics.recordError(new CalculationError(ref.id(), ref.type(), String.valueOf(e.getMessage())));
            return;
        }
        if (attempt.result() == null) {
            if (failFast) {
                throw new EmissionCalculationException(ref, attempt.failureReason());
            }
            log.warn("{} activity {} not calculable: {}", ref.type(), ref.id(), attempt.failureReason());
            statistics.recordError(new CalculationError(ref.id(), ref.type(), attempt.failureReason()));
            return;
        }
        statistics.recordSuccess(attempt.result());
        results.add(attempt.result());
        if (attempt.created()) {
            affectedDates.add(utcDate(attempt.result()));
        }
    }

    private Attempt attempt(ActivityRecord activity, int threshold, boolean skipDuplicateCheck) {
        ActivityRef ref = activity.ref();
        if (!skipDuplicateCheck) {
            List<EmissionResult> existing = emissionResultRepository.findByActivityTypeAndActivityId(ref.type(), ref.id());
            if (!existing.isEmpty()) {
                log.debug("Result already exists for {} activity {}", ref.type(), ref.id());
                return new Attempt(existing.get(0), false, null);
            }
        }
        ActivityCalculator<? extends ActivityRecord> calculator = calculators.get(ref.type());
        if (calculator == null) {
            throw new UnsupportedActivityTypeException(ref);
        }
        CalculationOutcome outcome = invoke(calculator, activity, threshold);
        if (!outcome.isCalculated()) {
            return new Attempt(null, false, outcome.getReason());
        }
        EmissionResult saved = emissionResultRepository.save(outcome.getResult().orElseThrow());
        log.debug("Calculated {} activity {}: {} t CO2e (confidence {})",
                ref.type(), ref.id(), saved.getCo2eTonnes(), saved.getConfidenceScore());
        return new Attempt(saved, true, null);
    }

    private static <A extends ActivityRecord> CalculationOutcome invoke(ActivityCalculator<A> calculator,
                                                                       ActivityRecord activity, int threshold) {
        return calculator.calculate(calculator.activityClass().cast(activity), threshold);
    }

    private void publishChanged(Set<LocalDate> affectedDates) {
        if (!affectedDates.isEmpty()) {
            applicationEventPublisher.publishEvent(new EmissionResultsChangedEvent(affectedDates));
        }
    }

    private static EmissionCalculationException wrap(ActivityRef ref, RuntimeException e) {
        if (e instanceof EmissionCalculationException calculationException) {
            return calculationException;
        }
        return new EmissionCalculationException(ref, String.valueOf(e.getMessage()), e);
    }

    private static LocalDate utcDate(EmissionResult result) {
        return LocalDate.ofInstant(result.getCalculationDate(), ZoneOffset.UTC);
    }

    private record Attempt(EmissionResult result, boolean created, String failureReason) {
    }

    private record BatchRun(CalculationStatistics statistics, List<EmissionResult> results,
                            Set<LocalDate> affectedDates) {

        static BatchRun empty() {
            return new BatchRun(CalculationStatistics.unbounded(), new ArrayList<>(), new HashSet<>());
        }

        void add(BatchRun other) {
            statistics.merge(other.statistics);
            results.addAll(other.results);
            affectedDates.addAll(other.affectedDates);
        }
    }

    private record PageResult(CalculationStatistics statistics, int trackedRecords, Set<LocalDate> affectedDates) {
    }
}
