package com.carbonledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calculated emissions for one activity. (activityType, activityId) is a weak reference into one of the
 * activity collections; the unique index keeps at most one live result per activity.
 * co2eTonnes has 7 fractional digits, confidenceScore 2.
 */
@Document(collection = "emission_results")
@CompoundIndexes({
        @CompoundIndex(name = "activityType_activityId", def = "{'activityType': 1, 'activityId': 1}", unique = true),
        @CompoundIndex(name = "calculationDate_activityType", def = "{'calculationDate': 1, 'activityType': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EmissionResult {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private ActivityType activityType;
    private String activityId;
    /** Stored as ObjectId so the aggregation pipeline can $lookup emission_factors._id. */
    @Indexed
    @Field(targetType = FieldType.OBJECT_ID)
    private String emissionFactorId;
    private BigDecimal co2eTonnes;
    private BigDecimal confidenceScore;
    private Map<String, String> calculationMetadata = new LinkedHashMap<>();
    private Instant calculationDate;
    private Instant createdAt;
    private Instant updatedAt;

    public ActivityRef activityRef() {
        return new ActivityRef(activityType, activityId);
    }
}
