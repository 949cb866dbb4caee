package com.carbonledger.config;

import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.AirTravelActivity;
import com.carbonledger.domain.EmissionFactor;
import com.carbonledger.domain.EmissionResult;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers
@Import(MongoConfig.class)
class EmissionDocumentsMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    @Test
    @DisplayName("fixed-point fields are stored as Decimal128 and read back exactly")
    void decimalRoundTrip() {
        EmissionResult result = new EmissionResult();
        result.setActivityType(ActivityType.AIR_TRAVEL);
        result.setActivityId("a-1");
        result.setEmissionFactorId(new ObjectId().toHexString());
        result.setCo2eTonnes(new BigDecimal("0.1207005"));
        result.setConfidenceScore(new BigDecimal("0.90"));
        result.setCalculationDate(Instant.parse("2024-03-01T10:00:00Z"));
        result.getCalculationMetadata().put("distance_km", "804.67");

        mongoTemplate.save(result);

        Document raw = mongoTemplate.getCollection("emission_results").find().first();
        assertThat(raw).isNotNull();
        assertThat(raw.get("co2eTonnes")).isInstanceOf(Decimal128.class);
        assertThat(raw.get("emissionFactorId")).isInstanceOf(ObjectId.class);

        EmissionResult read = mongoTemplate.findById(result.getId(), EmissionResult.class);
        assertThat(read).isNotNull();
        assertThat(read.getCo2eTonnes()).isEqualTo(new BigDecimal("0.1207005"));
        assertThat(read.getConfidenceScore().scale()).isEqualTo(2);
        assertThat(read.getConfidenceScore()).isEqualByComparingTo("0.90");
        assertThat(read.getEmissionFactorId()).isEqualTo(result.getEmissionFactorId());
        assertThat(read.getCalculationMetadata()).containsEntry("distance_km", "804.67");
    }

    @Test
    @DisplayName("soft-delete flag is stored as isDeleted")
    void activityDeletedFlag() {
        AirTravelActivity activity = new AirTravelActivity();
        activity.setDate(LocalDate.of(2024, 3, 1));
        activity.setDistanceMiles(new BigDecimal("500.00"));
        activity.setFlightRange("Long-haul");
        activity.setPassengerClass("Economy class");
        activity.setDeleted(true);

        mongoTemplate.save(activity);

        Document raw = mongoTemplate.getCollection("air_travel_activities").find().first();
        assertThat(raw).isNotNull();
        assertThat(raw.getBoolean("isDeleted")).isTrue();
        assertThat(raw.get("distanceMiles")).isInstanceOf(Decimal128.class);
    }

    @Test
    @DisplayName("emission collections carry their indexes")
    void indexesCreated() {
        mongoTemplate.save(new EmissionFactor());

        assertThat(indexNames("emission_results")).contains("activityType_activityId", "calculationDate_activityType");
        assertThat(indexNames("emission_summaries")).contains("summary_key");
        assertThat(indexNames("emission_factors")).contains("activityType_lookupIdentifier");
        assertThat(indexNames("electricity_activities")).contains("isDeleted_id");
    }

    private List<String> indexNames(String collection) {
        List<IndexInfo> indexes = mongoTemplate.indexOps(collection).getIndexInfo();
        return indexes.stream().map(IndexInfo::getName).toList();
    }
}
