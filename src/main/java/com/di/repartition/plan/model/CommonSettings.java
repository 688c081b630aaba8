package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Operator-editable part of a table plan: names of the table pair, the action and the target.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CommonSettings {

    @NotBlank
    String newTableName;

    @NotBlank
    String oldTableName;

    @NotNull
    MigrationAction migrationAction;

    @NotNull
    @Valid
    TargetConfiguration targetConfiguration;

    @NotNull
    @Valid
    MigrationSettings migrationSettings;
}
