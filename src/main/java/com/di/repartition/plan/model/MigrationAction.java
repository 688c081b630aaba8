package com.di.repartition.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the generated scripts must do to reach INTERVAL-HASH from the table's current layout.
 * Serialized with lower-case wire values; both wire values and constant names are accepted on read.
 */
public enum MigrationAction {
    ADD_INTERVAL_HASH_PARTITIONING("add_interval_hash_partitioning"),
    ADD_HASH_SUBPARTITIONS("add_hash_subpartitions"),
    CONVERT_INTERVAL_TO_INTERVAL_HASH("convert_interval_to_interval_hash"),
    CONVERT_TO_INTERVAL_HASH("convert_to_interval_hash");

    private final String value;

    MigrationAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MigrationAction fromValue(String value) {
        if (value != null) {
            for (MigrationAction action : values()) {
                if (action.value.equalsIgnoreCase(value.trim()) || action.name().equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown migration_action: " + value);
    }
}
