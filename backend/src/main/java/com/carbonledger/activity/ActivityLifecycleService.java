package com.carbonledger.activity;

import com.carbonledger.domain.ActivityRecord;
import com.carbonledger.domain.ActivityRef;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionResult;
import com.carbonledger.domain.EmissionResultRepository;
import com.carbonledger.domain.EmissionResultsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Active-record queries and soft deletion. Soft-deleting an activity removes its live results in the same
 * transaction so summaries refreshed afterwards exclude it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityLifecycleService {

    private final ActivityLookup activityLookup;
    private final EmissionResultRepository emissionResultRepository;
    private final TransactionOperations transactionOperations;
    private final ApplicationEventPublisher applicationEventPublisher;

    public Optional<ActivityRecord> findActive(ActivityRef ref) {
        return activityLookup.findActive(ref);
    }

    public List<? extends ActivityRecord> listActive(ActivityType type, int pageIndex, int pageSize) {
        if (pageIndex < 0 || pageSize <= 0) {
            throw new IllegalArgumentException("Invalid page: index=" + pageIndex + ", size=" + pageSize);
        }
        return activityLookup.findActivePage(type, pageIndex, pageSize);
    }

    public long countActive(ActivityType type) {
        return activityLookup.countActive(type);
    }

    /**
     * Mark the activity deleted and remove its results.
     *
     * @return false when the activity does not exist or is already deleted
     */
    public boolean softDelete(ActivityRef ref) {
        Set<LocalDate> affectedDates = new HashSet<>();
        Boolean deleted = transactionOperations.execute(status -> {
            Optional<ActivityRecord> found = activityLookup.findActive(ref);
            if (found.isEmpty()) {
                return false;
            }
            ActivityRecord activity = found.get();
            Instant now = Instant.now();
            activity.setDeleted(true);
            activity.setDeletedAt(now);
            activity.setUpdatedAt(now);
            activityLookup.save(activity);

            List<EmissionResult> results = emissionResultRepository.findByActivityTypeAndActivityId(ref.type(), ref.id());
            for (EmissionResult result : results) {
                affectedDates.add(LocalDate.ofInstant(result.getCalculationDate(), ZoneOffset.UTC));
            }
            emissionResultRepository.deleteAll(results);
            log.info("Soft-deleted {} activity {} and removed {} result(s)", ref.type(), ref.id(), results.size());
            return true;
        });
        if (!Boolean.TRUE.equals(deleted)) {
            log.debug("Activity {} not found or already deleted", ref);
            return false;
        }
        if (!affectedDates.isEmpty()) {
            applicationEventPublisher.publishEvent(new EmissionResultsChangedEvent(affectedDates));
        }
        return true;
    }
}
