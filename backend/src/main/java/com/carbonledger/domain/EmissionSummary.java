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
import java.time.LocalDate;

/**
 * Pre-computed rollup over a date range and optional dimensions. Written only by the aggregation engine.
 * Unique on (fromDate, toDate, scope, category, activityType, summaryType).
 */
@Document(collection = "emission_summaries")
@CompoundIndex(name = "summary_key",
        def = "{'fromDate': 1, 'toDate': 1, 'scope': 1, 'category': 1, 'activityType': 1, 'summaryType': 1}",
        unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EmissionSummary {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private LocalDate fromDate;
    private LocalDate toDate;
    private Integer scope;
    private Integer category;
    private ActivityType activityType;
    private BigDecimal totalCo2eTonnes;
    private long activityCount;
    private SummaryType summaryType;
    private Instant createdAt;
    private Instant updatedAt;

    public SummaryKey key() {
        return new SummaryKey(fromDate, toDate, scope, category, activityType, summaryType);
    }
}
