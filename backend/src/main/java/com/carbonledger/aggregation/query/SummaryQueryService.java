package com.carbonledger.aggregation.query;

import com.carbonledger.aggregation.SummaryDimension;
import com.carbonledger.domain.EmissionSummary;
import com.carbonledger.domain.EmissionSummaryRepository;
import com.carbonledger.domain.SummaryType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries over pre-computed summaries. Filters in {@link SummaryDimension} are applied only when
 * non-null; a null summaryType matches every granularity, so daily and monthly rows of the same range are
 * both included.
 */
@Service
@RequiredArgsConstructor
public class SummaryQueryService {

    private static final Map<Integer, String> CATEGORY_NAMES = Map.of(
            1, "Purchased Goods and Services",
            6, "Business Travel");

    private final EmissionSummaryRepository emissionSummaryRepository;

    /** Summaries with fromDate &gt;= from and toDate &lt;= to. */
    public List<EmissionSummary> findSummaries(LocalDate from, LocalDate to, SummaryDimension filters,
                                               SummaryType summaryType) {
        validateRange(from, to);
        return emissionSummaryRepository.findWithin(from, to, filters.scope(), filters.category(),
                filters.activityType(), summaryType);
    }

    public SummaryTotals totalEmissions(LocalDate from, LocalDate to, SummaryDimension filters,
                                        SummaryType summaryType) {
        SummaryTotals totals = SummaryTotals.EMPTY;
        for (EmissionSummary summary : findSummaries(from, to, filters, summaryType)) {
            totals = totals.plus(summary.getTotalCo2eTonnes(), summary.getActivityCount());
        }
        return totals;
    }

    /** Summaries lying within the calendar month. */
    public List<EmissionSummary> monthlySummaries(int year, int month, SummaryDimension filters) {
        YearMonth yearMonth;
        try {
            yearMonth = YearMonth.of(year, month);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Month must be between 1 and 12: " + month, e);
        }
        return findSummaries(yearMonth.atDay(1), yearMonth.atEndOfMonth(), filters, null);
    }

    /** Summary with the latest toDate matching the filters. */
    public Optional<EmissionSummary> latestSummary(SummaryDimension filters) {
        return emissionSummaryRepository.findLatest(filters.scope(), filters.category(), filters.activityType());
    }

    /**
     * Totals of every summary in range grouped by the dimension. Keys: "Scope n" / "All Scopes",
     * "Category n: name" / "All Categories", activity display name / "All Activities".
     */
    public Map<String, SummaryTotals> breakdown(LocalDate from, LocalDate to, BreakdownDimension dimension) {
        Map<String, SummaryTotals> breakdown = new LinkedHashMap<>();
        for (EmissionSummary summary : findSummaries(from, to, SummaryDimension.ALL, null)) {
            String key = switch (dimension) {
                case SCOPE -> summary.getScope() != null ? "Scope " + summary.getScope() : "All Scopes";
                case CATEGORY -> summary.getCategory() != null
                        ? "Category " + summary.getCategory() + ": " + CATEGORY_NAMES.getOrDefault(summary.getCategory(), "Unknown")
                        : "All Categories";
                case ACTIVITY -> summary.getActivityType() != null
                        ? summary.getActivityType().getDisplayName()
                        : "All Activities";
            };
            breakdown.merge(key, SummaryTotals.EMPTY.plus(summary.getTotalCo2eTonnes(), summary.getActivityCount()),
                    (a, b) -> new SummaryTotals(a.totalCo2eTonnes().add(b.totalCo2eTonnes()),
                            a.activityCount() + b.activityCount(), a.summariesAggregated() + b.summariesAggregated()));
        }
        return breakdown;
    }

    private static void validateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to dates are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from_date must be before or equal to to_date");
        }
    }
}
