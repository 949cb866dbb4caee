package com.carbonledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Attributes shared by every activity variant. Each variant lives in its own collection; activities are
 * soft-deleted (isDeleted + deletedAt) and excluded from sweeps and aggregation once deleted.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public abstract class ActivityRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private LocalDate date;
    private String sourceFile;
    /** Original import row, kept for audit. */
    private Map<String, String> rawData;
    @Field("isDeleted")
    private boolean deleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public abstract ActivityType getActivityType();

    public ActivityRef ref() {
        return new ActivityRef(getActivityType(), id);
    }
}
