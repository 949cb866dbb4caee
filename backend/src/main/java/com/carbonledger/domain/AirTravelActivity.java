package com.carbonledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Business air travel (Scope 3, category 6). Factor lookup key: "{flightRange}, {passengerClass}".
 * Distances have 2 fractional digits; distanceKm is backfilled from distanceMiles when absent.
 */
@Document(collection = "air_travel_activities")
@CompoundIndex(name = "isDeleted_id", def = "{'isDeleted': 1, '_id': 1}")
@NoArgsConstructor
@Getter
@Setter
public class AirTravelActivity extends ActivityRecord {

    private BigDecimal distanceMiles;
    private BigDecimal distanceKm;
    private String flightRange;
    private String passengerClass;

    @Override
    public ActivityType getActivityType() {
        return ActivityType.AIR_TRAVEL;
    }
}
