package com.carbonledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Converts heterogeneous numeric inputs into fixed-point BigDecimal and converts between distance units.
 * Never goes through binary floating point: doubles are read via their decimal string form.
 */
public final class UnitNormalizer {

    public static final BigDecimal MILES_TO_KM = new BigDecimal("1.60934");
    public static final BigDecimal KM_TO_MILES = new BigDecimal("0.621371");
    public static final BigDecimal KG_PER_TONNE = new BigDecimal("1000");

    /** Scale of persisted distances (miles and km). */
    public static final int DISTANCE_SCALE = 2;

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

    private UnitNormalizer() {
    }

    /**
     * Normalize a raw value to BigDecimal. Accepts BigDecimal, any Number, or a String that may carry
     * thousands separators, currency symbols or surrounding text (e.g. "£1,234.50").
     *
     * @throws IllegalArgumentException when the value is null or has no parseable number
     */
    public static BigDecimal normalize(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot normalize null value");
        }
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        String cleaned = NON_NUMERIC.matcher(value.toString()).replaceAll("");
        if (cleaned.isEmpty() || "-".equals(cleaned) || ".".equals(cleaned)) {
            throw new IllegalArgumentException("No numeric content in value: '" + value + "'");
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse numeric value: '" + value + "'", e);
        }
    }

    /** miles × 1.60934, 2 fractional digits. */
    public static BigDecimal milesToKm(BigDecimal miles) {
        return miles.multiply(MILES_TO_KM).setScale(DISTANCE_SCALE, RoundingMode.HALF_UP);
    }

    /** km × 0.621371, 2 fractional digits. */
    public static BigDecimal kmToMiles(BigDecimal km) {
        return km.multiply(KM_TO_MILES).setScale(DISTANCE_SCALE, RoundingMode.HALF_UP);
    }

    /** kg → tonnes at the given scale. */
    public static BigDecimal kgToTonnes(BigDecimal kg, int scale) {
        return kg.divide(KG_PER_TONNE, scale, RoundingMode.HALF_UP);
    }
}
