package com.carbonledger.aggregation.report;

import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionBreakdownRow;
import com.carbonledger.domain.EmissionResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link EmissionReport} from one server-side grouping of results by (activity type, scope, category),
 * without loading individual results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmissionReportService {

    private final EmissionResultRepository emissionResultRepository;

    public EmissionReport generate() {
        List<EmissionBreakdownRow> rows = emissionResultRepository.aggregateByTypeScopeAndCategory();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal scope2 = BigDecimal.ZERO;
        BigDecimal scope3 = BigDecimal.ZERO;
        BigDecimal category1 = BigDecimal.ZERO;
        BigDecimal category6 = BigDecimal.ZERO;
        long activities = 0;
        Map<ActivityType, BigDecimal> byType = new EnumMap<>(ActivityType.class);

        for (EmissionBreakdownRow row : rows) {
            BigDecimal co2e = row.totalCo2eTonnes();
            total = total.add(co2e);
            activities += row.count();
            byType.merge(row.activityType(), co2e, BigDecimal::add);
            if (row.scope() == null) {
                continue;
            }
            if (row.scope() == 2) {
                scope2 = scope2.add(co2e);
            } else if (row.scope() == 3) {
                scope3 = scope3.add(co2e);
                if (Integer.valueOf(1).equals(row.category())) {
                    category1 = category1.add(co2e);
                } else if (Integer.valueOf(6).equals(row.category())) {
                    category6 = category6.add(co2e);
                }
            }
        }
        log.info("Emissions report generated: {} activities, {} t CO2e total", activities, total);
        return new EmissionReport(total, scope2, scope3, category1, category6, activities,
                Collections.unmodifiableMap(byType), LocalDate.now(ZoneOffset.UTC));
    }
}
