package com.carbonledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * MongoDB configuration: Decimal128 codec for every fixed-point field, UTC java.time codecs for dates,
 * and a transaction manager so a batch or a streaming page commits as one unit.
 * Indexes are created from @CompoundIndex / @Indexed on domain documents at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return MongoCustomConversions.create(adapter -> {
            adapter.useNativeDriverJavaTimeCodecs();
            adapter.registerConverters(List.of(
                    new BigDecimalToDecimal128Converter(),
                    new Decimal128ToBigDecimalConverter()
            ));
        });
    }

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public TransactionTemplate transactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
