package com.di.repartition.plan.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class MigrationSettings {

    @PositiveOrZero
    Double estimatedHours;

    Priority priority;

    @Builder.Default
    boolean validateData = true;

    @Builder.Default
    boolean backupOldTable = true;

    /** Days to keep the old table after the swap; 0 drops it immediately. */
    @Builder.Default
    @PositiveOrZero
    Integer dropOldAfterDays = 7;

    @Builder.Default
    boolean migrateData = true;

    @Builder.Default
    boolean enableDeltaLoad = false;

    @Builder.Default
    IntervalType deltaLoadInterval = IntervalType.DAY;

    @Builder.Default
    boolean constraintValidation = true;

    @Builder.Default
    boolean autoEnableConstraints = true;
}
