package com.carbonledger.domain;

import java.util.Objects;

/**
 * Weak reference to one activity across the three activity collections: type tag plus id.
 * Resolution goes through an explicit per-type dispatch table, never through a generic foreign key.
 */
public record ActivityRef(ActivityType type, String id) {

    public ActivityRef {
        Objects.requireNonNull(type, "activity type must not be null");
        Objects.requireNonNull(id, "activity id must not be null");
    }

    @Override
    public String toString() {
        return type.getDisplayName() + ":" + id;
    }
}
