package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Physical state of a table at discovery time ({@code current_state} in the plan document).
 * Built once per discovery run and never mutated afterwards; hand edits go through {@code toBuilder()}.
 * <p>
 * The partition-state fields from {@code isInterval} down are only present when the table is
 * already partitioned.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableProfile {

    @NotNull
    Boolean isPartitioned;

    @NotNull
    PartitionType partitionType;

    /** {@code rows × avg_row_len / 1024³}, at least 0.01 for non-empty tables. */
    @PositiveOrZero
    double sizeGb;

    @PositiveOrZero
    long rowCount;

    @PositiveOrZero
    int lobCount;

    @PositiveOrZero
    int indexCount;

    @Builder.Default
    List<@Valid ColumnInfo> columns = List.of();

    @Builder.Default
    List<LobStorageInfo> lobStorage = List.of();

    StorageParameters storageParameters;

    @Builder.Default
    List<IndexInfo> indexes = List.of();

    @NotNull
    @Valid
    AvailableColumns availableColumns;

    Boolean isInterval;
    String intervalDefinition;
    Integer currentPartitionCount;
    /** Comma-separated partition key columns. */
    String currentPartitionKey;
    Boolean hasSubpartitions;
    /** Catalog subpartitioning type (HASH, LIST, RANGE); absent when there are none. */
    String subpartitionType;
    Integer subpartitionCount;

    @Builder.Default
    List<GrantInfo> grants = List.of();

    public boolean partitioned() {
        return Boolean.TRUE.equals(isPartitioned);
    }

    public boolean intervalPartitioned() {
        return Boolean.TRUE.equals(isInterval);
    }

    public boolean subpartitioned() {
        return Boolean.TRUE.equals(hasSubpartitions);
    }
}
