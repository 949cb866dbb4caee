package com.carbonledger.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads stored Decimal128 values (factor values, activity quantities, co2e tonnes and summary totals) back as
 * BigDecimal. The stored scale is preserved, so a factor written as 0.450000 reads back with 6 fractional digits.
 */
@ReadingConverter
public class Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    @Override
    public BigDecimal convert(Decimal128 source) {
        return source == null ? null : source.bigDecimalValue();
    }
}
