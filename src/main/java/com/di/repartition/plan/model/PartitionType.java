package com.di.repartition.plan.model;

/**
 * Table partitioning schemes as reported by the Oracle catalog ({@code all_part_tables.partitioning_type})
 * plus {@link #NONE} for heap tables and {@link #INTERVAL} for range tables with an interval clause.
 */
public enum PartitionType {
    NONE,
    RANGE,
    LIST,
    HASH,
    REFERENCE,
    SYSTEM,
    INTERVAL;

    /**
     * Maps a catalog partitioning type to the effective scheme. Oracle reports interval tables as
     * RANGE with a non-null interval definition.
     */
    public static PartitionType fromCatalog(String partitioningType, String intervalDefinition) {
        if (partitioningType == null || partitioningType.isBlank()) {
            return NONE;
        }
        PartitionType reported = valueOf(partitioningType.trim().toUpperCase());
        if (reported == RANGE && intervalDefinition != null && !intervalDefinition.isBlank()) {
            return INTERVAL;
        }
        return reported;
    }
}
