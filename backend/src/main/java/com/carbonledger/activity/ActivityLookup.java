package com.carbonledger.activity;

import com.carbonledger.domain.ActivityRecord;
import com.carbonledger.domain.ActivityRef;
import com.carbonledger.domain.ActivityRepository;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.AirTravelActivityRepository;
import com.carbonledger.domain.ElectricityActivityRepository;
import com.carbonledger.domain.GoodsServicesActivityRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatch table from {@link ActivityType} to the repository of its collection. The only place where an
 * {@link ActivityRef} is resolved to an activity.
 */
@Component
public class ActivityLookup {

    private static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "id");

    private final Map<ActivityType, ActivityRepository<? extends ActivityRecord>> repositories =
            new EnumMap<>(ActivityType.class);

    public ActivityLookup(ElectricityActivityRepository electricityActivityRepository,
                          AirTravelActivityRepository airTravelActivityRepository,
                          GoodsServicesActivityRepository goodsServicesActivityRepository) {
        repositories.put(ActivityType.ELECTRICITY, electricityActivityRepository);
        repositories.put(ActivityType.AIR_TRAVEL, airTravelActivityRepository);
        repositories.put(ActivityType.GOODS_SERVICES, goodsServicesActivityRepository);
    }

    /** Active (not soft-deleted) activity for the reference. */
    public Optional<ActivityRecord> findActive(ActivityRef ref) {
        return repositoryFor(ref.type()).findByIdAndDeletedFalse(ref.id()).map(ActivityRecord.class::cast);
    }

    /** Page of active activities ordered by id; offset = pageIndex × pageSize. */
    public List<? extends ActivityRecord> findActivePage(ActivityType type, int pageIndex, int pageSize) {
        return repositoryFor(type).findByDeletedFalse(PageRequest.of(pageIndex, pageSize, BY_ID));
    }

    public long countActive(ActivityType type) {
        return repositoryFor(type).countByDeletedFalse();
    }

    public ActivityRecord save(ActivityRecord activity) {
        return saveTyped(repositoryFor(activity.getActivityType()), activity);
    }

    private ActivityRepository<? extends ActivityRecord> repositoryFor(ActivityType type) {
        ActivityRepository<? extends ActivityRecord> repository = repositories.get(type);
        if (repository == null) {
            throw new IllegalStateException("No repository registered for activity type " + type);
        }
        return repository;
    }

    @SuppressWarnings("unchecked")
    private static <A extends ActivityRecord> A saveTyped(ActivityRepository<A> repository, ActivityRecord activity) {
        return repository.save((A) activity);
    }
}
