package com.di.repartition.discovery;

import com.di.repartition.plan.model.PartitionType;

import java.util.Locale;

/**
 * One {@code all_part_tables} row. {@code subpartitioningType} is null when the catalog says NONE.
 */
public record PartitionState(
        String partitioningType,
        String subpartitioningType,
        String intervalDefinition,
        Integer partitionCount,
        Integer defaultSubpartitionCount
) {

    /**
     * Catalog partitioning type as reported (interval tables stay RANGE here).
     *
     * @throws IllegalArgumentException for a type this tool does not model
     */
    public PartitionType partitionType() {
        if (partitioningType == null) {
            throw new IllegalArgumentException("Partitioning type missing from catalog");
        }
        return PartitionType.valueOf(partitioningType.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isInterval() {
        return intervalDefinition != null && !intervalDefinition.isBlank();
    }

    public boolean hasSubpartitions() {
        return subpartitioningType != null;
    }
}
