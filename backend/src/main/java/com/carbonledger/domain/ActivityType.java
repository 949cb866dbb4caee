package com.carbonledger.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Activity variants that can be converted into emissions. Display names match the factor catalogue.
 */
public enum ActivityType {
    ELECTRICITY("Electricity"),
    AIR_TRAVEL("Air Travel"),
    GOODS_SERVICES("Purchased Goods and Services");

    private final String displayName;

    ActivityType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Resolve by enum name or display name, case-insensitive. */
    public static Optional<ActivityType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(trimmed) || t.displayName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
