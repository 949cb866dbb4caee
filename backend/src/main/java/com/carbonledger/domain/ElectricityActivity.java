package com.carbonledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Purchased electricity (Scope 2). Factor lookup key: country. usageKwh has 4 fractional digits.
 */
@Document(collection = "electricity_activities")
@CompoundIndex(name = "isDeleted_id", def = "{'isDeleted': 1, '_id': 1}")
@NoArgsConstructor
@Getter
@Setter
public class ElectricityActivity extends ActivityRecord {

    private String country;
    private BigDecimal usageKwh;

    @Override
    public ActivityType getActivityType() {
        return ActivityType.ELECTRICITY;
    }
}
