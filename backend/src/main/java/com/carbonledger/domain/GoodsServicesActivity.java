package com.carbonledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Purchased goods and services (Scope 3, category 1), spend-based. Factor lookup key: supplierCategory.
 */
@Document(collection = "goods_services_activities")
@CompoundIndex(name = "isDeleted_id", def = "{'isDeleted': 1, '_id': 1}")
@NoArgsConstructor
@Getter
@Setter
public class GoodsServicesActivity extends ActivityRecord {

    private String supplierCategory;
    private BigDecimal spendAmount;
    private String description;

    @Override
    public ActivityType getActivityType() {
        return ActivityType.GOODS_SERVICES;
    }
}
