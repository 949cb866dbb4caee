package com.carbonledger.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.lookup;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.project;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.unwind;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of EmissionResultRepositoryCustom. Sums run server-side over Decimal128 so totals stay exact.
 */
@Repository
@RequiredArgsConstructor
public class EmissionResultRepositoryImpl implements EmissionResultRepositoryCustom {

    private static final String RESULTS = "emission_results";
    private static final String FACTORS = "emission_factors";

    private final MongoTemplate mongoTemplate;

    @Override
    public EmissionTotals aggregateTotals(Instant fromInclusive, Instant toExclusive,
                                          Integer scope, Integer category, ActivityType activityType) {
        Criteria resultCriteria = where("calculationDate").gte(fromInclusive).lt(toExclusive);
        if (activityType != null) {
            resultCriteria = resultCriteria.and("activityType").is(activityType.name());
        }
        List<AggregationOperation> ops = new ArrayList<>();
        ops.add(match(resultCriteria));
        ops.add(lookup(FACTORS, "emissionFactorId", "_id", "factor"));
        ops.add(unwind("factor"));
        if (scope != null || category != null) {
            List<Criteria> factorCriteria = new ArrayList<>();
            if (scope != null) {
                factorCriteria.add(where("factor.scope").is(scope));
            }
            if (category != null) {
                factorCriteria.add(where("factor.category").is(category));
            }
            ops.add(match(new Criteria().andOperator(factorCriteria)));
        }
        ops.add(group().sum("co2eTonnes").as("total").count().as("count"));

        List<Document> rows = mongoTemplate.aggregate(Aggregation.newAggregation(ops), RESULTS, Document.class)
                .getMappedResults();
        if (rows.isEmpty()) {
            return EmissionTotals.empty();
        }
        Document row = rows.get(0);
        return new EmissionTotals(toBigDecimal(row.get("total")), toLong(row.get("count")));
    }

    @Override
    public List<EmissionBreakdownRow> aggregateByTypeScopeAndCategory() {
        Aggregation aggregation = Aggregation.newAggregation(
                lookup(FACTORS, "emissionFactorId", "_id", "factor"),
                unwind("factor"),
                project("activityType", "co2eTonnes")
                        .and("factor.scope").as("scope")
                        .and("factor.category").as("category"),
                group("activityType", "scope", "category").sum("co2eTonnes").as("total").count().as("count")
        );
        List<Document> rows = mongoTemplate.aggregate(aggregation, RESULTS, Document.class).getMappedResults();
        List<EmissionBreakdownRow> breakdown = new ArrayList<>(rows.size());
        for (Document row : rows) {
            Document key = row.get("_id", Document.class);
            breakdown.add(new EmissionBreakdownRow(
                    ActivityType.valueOf(key.getString("activityType")),
                    toInteger(key.get("scope")),
                    toInteger(key.get("category")),
                    toBigDecimal(row.get("total")),
                    toLong(row.get("count"))));
        }
        return breakdown;
    }

    @Override
    public List<String> findActivityIdsWithResults(ActivityType activityType, int limit) {
        Query query = new Query(where("activityType").is(activityType))
                .with(Sort.by(Sort.Direction.ASC, "activityId"))
                .limit(limit);
        query.fields().include("activityId");
        return mongoTemplate.find(query, EmissionResult.class).stream()
                .map(EmissionResult::getActivityId)
                .toList();
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static Integer toInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }
}
