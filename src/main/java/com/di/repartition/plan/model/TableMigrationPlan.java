package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Everything known and decided about one table: its profile and its recommended target.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableMigrationPlan {

    boolean enabled;

    @NotBlank
    String owner;

    @NotBlank
    String tableName;

    @NotNull
    @Valid
    TableProfile currentState;

    @NotNull
    @Valid
    CommonSettings commonSettings;

    public TargetConfiguration target() {
        return commonSettings == null ? null : commonSettings.getTargetConfiguration();
    }

    public MigrationSettings settings() {
        return commonSettings == null ? null : commonSettings.getMigrationSettings();
    }

    public MigrationAction action() {
        return commonSettings == null ? null : commonSettings.getMigrationAction();
    }

    /** Name of the new table, defaulting to {@code <table>_NEW}. */
    public String newTableName() {
        if (commonSettings != null && commonSettings.getNewTableName() != null) {
            return commonSettings.getNewTableName();
        }
        return tableName + "_NEW";
    }

    public String qualifiedName() {
        return owner + "." + tableName;
    }
}
