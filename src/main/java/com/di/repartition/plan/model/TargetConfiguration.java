package com.di.repartition.plan.model;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Recommended (or operator-edited) target layout. Range checks on the numeric fields are
 * logical-tier rules, so out-of-range values still bind and get reported with a table prefix.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TargetConfiguration {

    public static final String DEFAULT_INITIAL_PARTITION_VALUE = "TO_DATE('2024-01-01', 'YYYY-MM-DD')";

    @NotNull
    PartitionType partitionType;

    String partitionColumn;
    IntervalType intervalType;

    @Builder.Default
    Integer intervalValue = 1;

    @Builder.Default
    String initialPartitionValue = DEFAULT_INITIAL_PARTITION_VALUE;

    SubpartitionType subpartitionType;
    String subpartitionColumn;
    Integer subpartitionCount;
    String tablespace;

    @Builder.Default
    List<String> lobTablespaces = List.of();

    Integer parallelDegree;

    public boolean hashSubpartitioned() {
        return subpartitionType == SubpartitionType.HASH;
    }
}
