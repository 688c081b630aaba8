package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The plan document: produced by discovery, optionally hand-edited, then read by both validators.
 * Table order is the discovery order and is preserved through persistence.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MigrationPlanDocument {

    @NotNull
    @Valid
    PlanMetadata metadata;

    @NotNull
    @Valid
    EnvironmentProfile environmentConfig;

    @NotNull
    @Builder.Default
    List<@Valid @NotNull TableMigrationPlan> tables = List.of();

    public List<TableMigrationPlan> enabledTables() {
        return tables.stream().filter(TableMigrationPlan::isEnabled).collect(Collectors.toList());
    }

    public Optional<TableMigrationPlan> findTable(String tableName) {
        if (tableName == null) return Optional.empty();
        return tables.stream()
                .filter(t -> tableName.equalsIgnoreCase(t.getTableName()))
                .findFirst();
    }
}
