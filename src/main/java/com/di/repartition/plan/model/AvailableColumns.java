package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Candidate columns for the partition key (timestamp-like) and the hash subpartition key
 * (numeric or short string), in preference order.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AvailableColumns {

    @Builder.Default
    List<@Valid ColumnInfo> timestampColumns = List.of();

    @Builder.Default
    List<@Valid ColumnInfo> numericColumns = List.of();

    @Builder.Default
    List<@Valid ColumnInfo> stringColumns = List.of();

    public List<String> timestampColumnNames() {
        return names(timestampColumns);
    }

    /** Numeric column names followed by string column names. */
    public List<String> hashCandidateNames() {
        List<String> all = new ArrayList<>(names(numericColumns));
        all.addAll(names(stringColumns));
        return all;
    }

    private static List<String> names(List<ColumnInfo> columns) {
        if (columns == null) return List.of();
        return columns.stream().map(ColumnInfo::getName).collect(Collectors.toList());
    }
}
