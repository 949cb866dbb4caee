package com.carbonledger.calculation.engine;

import com.carbonledger.activity.ActivityLookup;
import com.carbonledger.calculation.calculator.ActivityCalculator;
import com.carbonledger.calculation.calculator.ElectricityCalculator;
import com.carbonledger.calculation.calculator.GoodsServicesCalculator;
import com.carbonledger.calculation.config.CalculationProperties;
import com.carbonledger.calculation.matcher.FactorMatch;
import com.carbonledger.calculation.matcher.FactorMatcher;
import com.carbonledger.calculation.matcher.MatchMethod;
import com.carbonledger.domain.ActivityRecord;
import com.carbonledger.domain.ActivityRef;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.ElectricityActivity;
import com.carbonledger.domain.EmissionFactor;
import com.carbonledger.domain.EmissionResult;
import com.carbonledger.domain.EmissionResultRepository;
import com.carbonledger.domain.EmissionResultsChangedEvent;
import com.carbonledger.domain.GoodsServicesActivity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EmissionCalculationServiceTest {

    private static final String UK = "United Kingdom";
    private static final String OFFICE = "Office Supplies";

    @Mock
    FactorMatcher factorMatcher;
    @Mock
    EmissionResultRepository emissionResultRepository;
    @Mock
    ActivityLookup activityLookup;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private CalculationProperties properties;
    private EmissionCalculationService service;

    @BeforeEach
    void setUp() {
        properties = new CalculationProperties();
        service = newService(List.of(new ElectricityCalculator(factorMatcher), new GoodsServicesCalculator(factorMatcher)));

        EmissionFactor ukFactor = factor("f-uk", ActivityType.ELECTRICITY, UK, "0.300000");
        EmissionFactor officeFactor = factor("f-office", ActivityType.GOODS_SERVICES, OFFICE, "0.500000");
        when(factorMatcher.match(eq(ActivityType.ELECTRICITY), eq(UK), anyInt()))
                .thenReturn(Optional.of(new FactorMatch(ukFactor, new BigDecimal("1.00"), MatchMethod.EXACT)));
        when(factorMatcher.match(eq(ActivityType.GOODS_SERVICES), eq(OFFICE), anyInt()))
                .thenReturn(Optional.of(new FactorMatch(officeFactor, new BigDecimal("1.00"), MatchMethod.EXACT)));
        when(emissionResultRepository.save(any(EmissionResult.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private EmissionCalculationService newService(List<ActivityCalculator<? extends ActivityRecord>> calculators) {
        return new EmissionCalculationService(calculators, emissionResultRepository, activityLookup,
                TransactionOperations.withoutTransaction(), applicationEventPublisher, properties);
    }

    private EmissionCalculationService newService(TransactionOperations transactions) {
        return new EmissionCalculationService(List.of(new ElectricityCalculator(factorMatcher)), emissionResultRepository,
                activityLookup, transactions, applicationEventPublisher, properties);
    }

    /** Runs each callback, then fails the commit of the given 1-based transaction numbers. */
    private static TransactionOperations commitFailingOn(Set<Integer> failingTransactions) {
        AtomicInteger transactions = new AtomicInteger();
        return new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                T result = action.doInTransaction(new SimpleTransactionStatus());
                if (failingTransactions.contains(transactions.incrementAndGet())) {
                    throw new IllegalStateException("Transaction has been aborted");
                }
                return result;
            }
        };
    }

    private static EmissionFactor factor(String id, ActivityType type, String identifier, String value) {
        EmissionFactor factor = new EmissionFactor();
        factor.setId(id);
        factor.setActivityType(type);
        factor.setLookupIdentifier(identifier);
        factor.setUnit("unit");
        factor.setCo2eFactor(new BigDecimal(value));
        factor.setScope(type == ActivityType.ELECTRICITY ? 2 : 3);
        return factor;
    }

    private static ElectricityActivity electricity(String id, String country, String kwh) {
        ElectricityActivity activity = new ElectricityActivity();
        activity.setId(id);
        activity.setCountry(country);
        activity.setUsageKwh(new BigDecimal(kwh));
        return activity;
    }

    private static GoodsServicesActivity goods(String id) {
        GoodsServicesActivity activity = new GoodsServicesActivity();
        activity.setId(id);
        activity.setSupplierCategory(OFFICE);
        activity.setSpendAmount(new BigDecimal("1000"));
        return activity;
    }

    private static List<ElectricityActivity> electricityActivities(int count, String country) {
        return IntStream.range(0, count)
                .mapToObj(i -> electricity(String.format("e-%05d", i), country, "1000"))
                .collect(Collectors.toList());
    }

    private void stubElectricityPages(List<ElectricityActivity> all) {
        when(activityLookup.findActivePage(eq(ActivityType.ELECTRICITY), anyInt(), anyInt())).thenAnswer(inv -> {
            int pageIndex = inv.getArgument(1);
            int pageSize = inv.getArgument(2);
            int from = Math.min(pageIndex * pageSize, all.size());
            int to = Math.min(from + pageSize, all.size());
            return new ArrayList<>(all.subList(from, to));
        });
    }

    @Test
    void rejectsThresholdOutsideRange() {
        properties.setFuzzyThreshold(101);

        assertThatThrownBy(() -> newService(List.of(new ElectricityCalculator(factorMatcher))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDuplicateCalculators() {
        assertThatThrownBy(() -> newService(List.of(
                new ElectricityCalculator(factorMatcher), new ElectricityCalculator(factorMatcher))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ELECTRICITY");
    }

    @Nested
    @DisplayName("calculateSingle")
    class Single {

        @Test
        @DisplayName("creates one result and publishes the affected date")
        void createsResult() {
            Optional<EmissionResult> result = service.calculateSingle(electricity("e-1", UK, "1000"));

            assertThat(result).isPresent();
            assertThat(result.get().getCo2eTonnes()).isEqualByComparingTo("0.3");
            verify(emissionResultRepository).save(any(EmissionResult.class));
            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(((EmissionResultsChangedEvent) event.getValue()).affectedDates())
                    .containsExactly(LocalDate.ofInstant(result.get().getCalculationDate(), ZoneOffset.UTC));
        }

        @Test
        @DisplayName("returns the existing result unchanged on a repeated call")
        void idempotent() {
            EmissionResult existing = new EmissionResult();
            existing.setId("r-1");
            existing.setActivityType(ActivityType.ELECTRICITY);
            existing.setActivityId("e-1");
            existing.setCo2eTonnes(new BigDecimal("0.3000000"));
            when(emissionResultRepository.findByActivityTypeAndActivityId(ActivityType.ELECTRICITY, "e-1"))
                    .thenReturn(List.of(existing));

            Optional<EmissionResult> result = service.calculateSingle(electricity("e-1", UK, "1000"));

            assertThat(result).containsSame(existing);
            verify(emissionResultRepository, never()).save(any(EmissionResult.class));
            verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("not calculable yields empty without saving")
        void notCalculable() {
            assertThat(service.calculateSingle(electricity("e-2", "Atlantis", "10"))).isEmpty();
            verify(emissionResultRepository, never()).save(any(EmissionResult.class));
        }

        @Test
        @DisplayName("unsupported activity type raises when asked to")
        void unsupportedType() {
            EmissionCalculationService electricityOnly = newService(List.of(new ElectricityCalculator(factorMatcher)));

            assertThat(electricityOnly.calculateSingle(goods("g-1"))).isEmpty();
            assertThatThrownBy(() -> electricityOnly.calculateSingle(goods("g-1"), 80, true, false))
                    .isInstanceOf(UnsupportedActivityTypeException.class)
                    .hasMessageContaining("Purchased Goods and Services activity g-1");
        }

        @Test
        @DisplayName("unexpected failure is logged, or wrapped with its cause when raising")
        void unexpectedFailure() {
            IllegalStateException boom = new IllegalStateException("store unavailable");
            when(emissionResultRepository.save(any(EmissionResult.class))).thenThrow(boom);

            assertThat(service.calculateSingle(electricity("e-3", UK, "1"))).isEmpty();
            assertThatThrownBy(() -> service.calculateSingle(electricity("e-3", UK, "1"), 80, true, false))
                    .isInstanceOf(EmissionCalculationException.class)
                    .hasCause(boom)
                    .hasMessage("Failed to calculate emissions for Electricity activity e-3: store unavailable");
        }
    }

    @Nested
    @DisplayName("calculateBatch")
    class Batch {

        @Test
        @DisplayName("records a failure and keeps the successes")
        void partialFailure() {
            BatchCalculationResult batch = service.calculateBatch(List.of(
                    electricity("e-ok", UK, "1000"), electricity("e-bad", "Atlantis", "1000")));

            assertThat(batch.results()).hasSize(1);
            CalculationSummary summary = batch.summary();
            assertThat(summary.totalActivities()).isEqualTo(2);
            assertThat(summary.totalProcessed()).isEqualTo(1);
            assertThat(summary.totalErrors()).isEqualTo(1);
            assertThat(summary.successRate()).isEqualTo("50.00%");
            assertThat(summary.totalCo2eTonnes()).isEqualByComparingTo("0.3");
            assertThat(summary.errors()).singleElement()
                    .satisfies(error -> {
                        assertThat(error.activityId()).isEqualTo("e-bad");
                        assertThat(error.activityType()).isEqualTo(ActivityType.ELECTRICITY);
                        assertThat(error.error()).contains("Atlantis");
                    });
            assertThat(summary.byActivityType().get(ActivityType.ELECTRICITY).count()).isEqualTo(1);
        }

        @Test
        @DisplayName("fail-fast throws on the first failure and stops")
        void failFast() {
            List<ElectricityActivity> activities = List.of(
                    electricity("e-bad", "Atlantis", "1"), electricity("e-ok", UK, "1000"));

            assertThatThrownBy(() -> service.calculateBatch(activities, 80, true))
                    .isInstanceOf(EmissionCalculationException.class)
                    .satisfies(e -> assertThat(((EmissionCalculationException) e).getActivityRef())
                            .isEqualTo(new ActivityRef(ActivityType.ELECTRICITY, "e-bad")));
            verify(emissionResultRepository, never()).save(any(EmissionResult.class));
            verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("a failed batch commit is retried per activity and keeps every success")
        void failedCommitRetriedPerActivity() {
            service = newService(commitFailingOn(Set.of(1)));

            BatchCalculationResult batch = service.calculateBatch(List.of(
                    electricity("e-1", UK, "1000"), electricity("e-2", UK, "1000"), electricity("e-3", UK, "1000")));

            assertThat(batch.results()).extracting(EmissionResult::getActivityId).containsExactly("e-1", "e-2", "e-3");
            assertThat(batch.summary().totalErrors()).isZero();
            assertThat(batch.summary().totalCo2eTonnes()).isEqualByComparingTo("0.9");
            verify(applicationEventPublisher, times(1)).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("an activity whose own retry fails is recorded and the others commit")
        void retryFailureRecorded() {
            service = newService(commitFailingOn(Set.of(1, 3)));

            BatchCalculationResult batch = service.calculateBatch(List.of(
                    electricity("e-1", UK, "1000"), electricity("e-2", UK, "1000"), electricity("e-3", UK, "1000")));

            assertThat(batch.results()).extracting(EmissionResult::getActivityId).containsExactly("e-1", "e-3");
            assertThat(batch.summary().successRate()).isEqualTo("66.67%");
            assertThat(batch.summary().errors()).singleElement()
                    .satisfies(error -> {
                        assertThat(error.activityId()).isEqualTo("e-2");
                        assertThat(error.error()).isEqualTo("Transaction failed: Transaction has been aborted");
                    });
        }

        @Test
        @DisplayName("a result written concurrently is returned on retry instead of failing the batch")
        void concurrentDuplicateResolvedOnRetry() {
            service = newService(commitFailingOn(Set.of(1)));
            EmissionResult concurrent = new EmissionResult();
            concurrent.setId("r-other");
            concurrent.setActivityType(ActivityType.ELECTRICITY);
            concurrent.setActivityId("e-2");
            concurrent.setCo2eTonnes(new BigDecimal("0.3000000"));
            when(emissionResultRepository.findByActivityTypeAndActivityId(ActivityType.ELECTRICITY, "e-2"))
                    .thenReturn(List.of(), List.of(concurrent));
            when(emissionResultRepository.save(argThat((EmissionResult r) -> r != null && "e-2".equals(r.getActivityId()))))
                    .thenThrow(new DuplicateKeyException("E11000 duplicate key error"));

            BatchCalculationResult batch = service.calculateBatch(List.of(
                    electricity("e-1", UK, "1000"), electricity("e-2", UK, "1000"), electricity("e-3", UK, "1000")));

            assertThat(batch.results()).hasSize(3).anySatisfy(r -> assertThat(r).isSameAs(concurrent));
            assertThat(batch.summary().totalProcessed()).isEqualTo(3);
            assertThat(batch.summary().totalErrors()).isZero();
            verify(emissionResultRepository, times(5)).save(any(EmissionResult.class));
        }

        @Test
        @DisplayName("empty batch reports 0.00%")
        void emptyBatch() {
            BatchCalculationResult batch = service.calculateBatch(List.of());

            assertThat(batch.results()).isEmpty();
            assertThat(batch.summary().successRate()).isEqualTo("0.00%");
        }
    }

    @Nested
    @DisplayName("recalculate")
    class Recalculate {

        @Test
        @DisplayName("replaces the prior result and publishes both dates")
        void replacesPriorResult() {
            EmissionResult prior = new EmissionResult();
            prior.setId("r-old");
            prior.setCalculationDate(Instant.parse("2024-03-01T10:00:00Z"));
            List<EmissionResult> priorResults = List.of(prior);
            when(emissionResultRepository.findByActivityTypeAndActivityId(ActivityType.ELECTRICITY, "e-1"))
                    .thenReturn(priorResults);

            Optional<EmissionResult> result = service.recalculate(electricity("e-1", UK, "2000"));

            assertThat(result).isPresent();
            assertThat(result.get().getCo2eTonnes()).isEqualByComparingTo("0.6");
            verify(emissionResultRepository).deleteAll(priorResults);
            verify(emissionResultRepository).save(any(EmissionResult.class));
            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(((EmissionResultsChangedEvent) event.getValue()).affectedDates())
                    .contains(LocalDate.of(2024, 3, 1))
                    .contains(LocalDate.ofInstant(result.get().getCalculationDate(), ZoneOffset.UTC));
        }

        @Test
        @DisplayName("failure is rethrown wrapped")
        void failureRethrown() {
            when(emissionResultRepository.save(any(EmissionResult.class))).thenThrow(new IllegalStateException("down"));

            assertThatThrownBy(() -> service.recalculate(electricity("e-1", UK, "2000")))
                    .isInstanceOf(EmissionCalculationException.class)
                    .hasMessageContaining("down");
        }

        @Test
        @DisplayName("by reference: missing or deleted activity yields empty")
        void missingReference() {
            ActivityRef ref = new ActivityRef(ActivityType.ELECTRICITY, "missing");
            when(activityLookup.findActive(ref)).thenReturn(Optional.empty());

            assertThat(service.calculateByActivityRef(ref, true)).isEmpty();
            assertThat(service.calculateByActivityRef(ref, false)).isEmpty();
            verify(emissionResultRepository, never()).findByActivityTypeAndActivityId(any(), anyString());
        }

        @Test
        @DisplayName("by reference: resolves and calculates")
        void resolvesReference() {
            ActivityRef ref = new ActivityRef(ActivityType.ELECTRICITY, "e-9");
            when(activityLookup.findActive(ref)).thenReturn(Optional.of(electricity("e-9", UK, "10")));

            assertThat(service.calculateByActivityRef(ref, false)).isPresent();
        }
    }

    @Nested
    @DisplayName("calculateAllPending")
    class Sweep {

        @Test
        @DisplayName("streaming keeps at most two records per activity of a page in memory")
        void streamingMemoryBound() {
            stubElectricityPages(electricityActivities(1000, UK));
            List<Integer> tracked = new ArrayList<>();

            CalculationSummary summary = service.calculateAllPending(50, true, () -> false,
                    (partition, pageIndex, trackedRecords, processedSoFar) -> tracked.add(trackedRecords));

            assertThat(summary.totalProcessed()).isEqualTo(1000);
            assertThat(summary.totalErrors()).isZero();
            assertThat(summary.successRate()).isEqualTo("100.00%");
            assertThat(summary.cancelled()).isFalse();
            assertThat(summary.totalCo2eTonnes()).isEqualByComparingTo("300");
            assertThat(tracked).hasSize(20).allSatisfy(t -> assertThat(t).isLessThanOrEqualTo(100));
            verify(activityLookup, never()).findActivePage(any(), anyInt(), eq(1000));
            verify(emissionResultRepository, times(1000)).save(any(EmissionResult.class));
        }

        @Test
        @DisplayName("activities with results are skipped and not counted")
        void skipsExisting() {
            stubElectricityPages(electricityActivities(10, UK));
            Set<String> existing = Set.of("e-00000", "e-00003", "e-00007");
            when(emissionResultRepository.existsByActivityTypeAndActivityId(eq(ActivityType.ELECTRICITY), anyString()))
                    .thenAnswer(inv -> existing.contains(inv.<String>getArgument(1)));

            CalculationSummary summary = service.calculateAllPending(4, true);

            assertThat(summary.totalActivities()).isEqualTo(7);
            assertThat(summary.totalProcessed()).isEqualTo(7);
            verify(emissionResultRepository, times(7)).save(any(EmissionResult.class));
        }

        @Test
        @DisplayName("error records are bounded by the sample size while all failures are counted")
        void boundedErrorSample() {
            properties.setErrorSampleSize(10);
            service = newService(List.of(new ElectricityCalculator(factorMatcher)));
            stubElectricityPages(electricityActivities(25, "Atlantis"));

            CalculationSummary summary = service.calculateAllPending(7, true);

            assertThat(summary.totalErrors()).isEqualTo(25);
            assertThat(summary.errors()).hasSize(10);
            assertThat(summary.successRate()).isEqualTo("0.00%");
        }

        @Test
        @DisplayName("cancellation stops at the next page boundary")
        void cancellation() {
            stubElectricityPages(electricityActivities(200, UK));
            AtomicInteger checks = new AtomicInteger();

            CalculationSummary summary = service.calculateAllPending(50, true,
                    () -> checks.incrementAndGet() > 2, SweepProgressCallback.NONE);

            assertThat(summary.cancelled()).isTrue();
            assertThat(summary.totalProcessed()).isEqualTo(100);
            verify(applicationEventPublisher, times(1)).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("a multi-page sweep publishes one change event with the dates of every page")
        void publishesOnceForWholeSweep() {
            stubElectricityPages(electricityActivities(1000, UK));

            CalculationSummary summary = service.calculateAllPending(10, true);

            assertThat(summary.totalProcessed()).isEqualTo(1000);
            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            verify(applicationEventPublisher, times(1)).publishEvent(event.capture());
            assertThat(((EmissionResultsChangedEvent) event.getValue()).affectedDates())
                    .isNotEmpty()
                    .allSatisfy(date -> assertThat(date).isBeforeOrEqualTo(LocalDate.now(ZoneOffset.UTC)));
        }

        @Test
        @DisplayName("a failed page commit records every activity of the page as an error")
        void failedPageCommit() {
            service = new EmissionCalculationService(List.of(new ElectricityCalculator(factorMatcher)),
                    emissionResultRepository, activityLookup, new TransactionOperations() {
                        @Override
                        public <T> T execute(TransactionCallback<T> action) {
                            action.doInTransaction(new SimpleTransactionStatus());
                            throw new IllegalStateException("commit failed");
                        }
                    }, applicationEventPublisher, properties);
            stubElectricityPages(electricityActivities(3, UK));

            CalculationSummary summary = service.calculateAllPending(5, true);

            assertThat(summary.totalProcessed()).isZero();
            assertThat(summary.totalErrors()).isEqualTo(3);
            assertThat(summary.errors()).allSatisfy(e -> assertThat(e.error()).startsWith("Page commit failed"));
            verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("in-memory mode filters activities that already have results")
        void inMemory() {
            List<ElectricityActivity> all = electricityActivities(5, UK);
            when(activityLookup.findActivePage(ActivityType.ELECTRICITY, 0, properties.getLegacyMaxRecords()))
                    .thenAnswer(inv -> new ArrayList<>(all));
            when(emissionResultRepository.findActivityIdsWithResults(ActivityType.ELECTRICITY, properties.getLegacyMaxRecords()))
                    .thenReturn(List.of("e-00001", "e-00002"));
            List<Integer> tracked = new ArrayList<>();

            CalculationSummary summary = service.calculateAllPending(2, false, () -> false,
                    (partition, pageIndex, trackedRecords, processedSoFar) -> tracked.add(trackedRecords));

            assertThat(summary.totalProcessed()).isEqualTo(3);
            assertThat(tracked).containsExactly(5, 5);
            verify(emissionResultRepository, never()).existsByActivityTypeAndActivityId(any(), anyString());
        }

        @Test
        @DisplayName("in-memory mode also publishes a single event")
        void inMemoryPublishesOnce() {
            List<ElectricityActivity> all = electricityActivities(9, UK);
            when(activityLookup.findActivePage(ActivityType.ELECTRICITY, 0, properties.getLegacyMaxRecords()))
                    .thenAnswer(inv -> new ArrayList<>(all));

            CalculationSummary summary = service.calculateAllPending(2, false);

            assertThat(summary.totalProcessed()).isEqualTo(9);
            verify(applicationEventPublisher, times(1)).publishEvent(any(Object.class));
        }

        @Test
        void rejectsNonPositiveBatchSize() {
            assertThatThrownBy(() -> service.calculateAllPending(0, true))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
