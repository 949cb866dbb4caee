package com.carbonledger.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of EmissionSummaryRepositoryCustom using MongoTemplate queries.
 */
@Repository
@RequiredArgsConstructor
public class EmissionSummaryRepositoryImpl implements EmissionSummaryRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<EmissionSummary> findByKey(SummaryKey key) {
        Query query = new Query(where("fromDate").is(key.fromDate())
                .and("toDate").is(key.toDate())
                .and("scope").is(key.scope())
                .and("category").is(key.category())
                .and("activityType").is(key.activityType())
                .and("summaryType").is(key.summaryType()));
        return Optional.ofNullable(mongoTemplate.findOne(query, EmissionSummary.class));
    }

    @Override
    public List<EmissionSummary> findWithin(LocalDate from, LocalDate to, Integer scope, Integer category,
                                            ActivityType activityType, SummaryType summaryType) {
        Criteria criteria = withFilters(where("fromDate").gte(from).and("toDate").lte(to), scope, category, activityType);
        if (summaryType != null) {
            criteria = criteria.and("summaryType").is(summaryType);
        }
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.ASC, "fromDate", "toDate"));
        return mongoTemplate.find(query, EmissionSummary.class);
    }

    @Override
    public Optional<EmissionSummary> findLatest(Integer scope, Integer category, ActivityType activityType) {
        Query query = new Query();
        if (scope != null) {
            query.addCriteria(where("scope").is(scope));
        }
        if (category != null) {
            query.addCriteria(where("category").is(category));
        }
        if (activityType != null) {
            query.addCriteria(where("activityType").is(activityType));
        }
        query.with(Sort.by(Sort.Direction.DESC, "toDate"))
                .limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, EmissionSummary.class));
    }

    private static Criteria withFilters(Criteria criteria, Integer scope, Integer category, ActivityType activityType) {
        if (scope != null) {
            criteria = criteria.and("scope").is(scope);
        }
        if (category != null) {
            criteria = criteria.and("category").is(category);
        }
        if (activityType != null) {
            criteria = criteria.and("activityType").is(activityType);
        }
        return criteria;
    }
}
