package com.carbonledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Reference coefficient converting an activity quantity into kg CO2e per unit. co2eFactor has 6 fractional digits.
 * (activityType, lookupIdentifier) is expected to be unique but is not enforced; duplicates only degrade matching.
 */
@Document(collection = "emission_factors")
@CompoundIndex(name = "activityType_lookupIdentifier", def = "{'activityType': 1, 'lookupIdentifier': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EmissionFactor {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private ActivityType activityType;
    private String lookupIdentifier;
    private String unit;
    private BigDecimal co2eFactor;
    private int scope;
    /** Scope 3 category number; null for scopes 1 and 2. */
    private Integer category;
    private String source;
    private String notes;
    private Instant createdAt;
    private Instant updatedAt;
}
