package com.di.repartition.recommend;

import com.di.repartition.plan.model.AvailableColumns;
import com.di.repartition.plan.model.EnvironmentProfile;
import com.di.repartition.plan.model.IntervalType;
import com.di.repartition.plan.model.MigrationAction;
import com.di.repartition.plan.model.MigrationSettings;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.Priority;
import com.di.repartition.plan.model.SubpartitionType;
import com.di.repartition.plan.model.TableProfile;
import com.di.repartition.plan.model.TargetConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Sizing rules that turn a {@link TableProfile} into a target INTERVAL-HASH layout.
 * All functions are deterministic and free of I/O.
 */
@Slf4j
public final class PartitionRecommender {

    private PartitionRecommender() {}

    // ============================================================================
    // Thresholds
    // ============================================================================

    private static final double HUGE_TABLE_GB = 100;
    private static final double LARGE_TABLE_GB = 50;
    private static final double MEDIUM_TABLE_GB = 10;
    private static final double SMALL_TABLE_GB = 1;

    private static final double ROWS_PER_DAY_HOURLY = 1_000_000;
    private static final double ROWS_PER_DAY_DAILY = 100_000;
    /** Row counts are assumed to cover one year of data. */
    private static final double DAYS_OF_DATA = 365;

    private static final double GB_PER_HOUR = 8;
    private static final double MIN_HOURS = 0.1;
    private static final double HOURS_PER_INDEX = 0.75;

    // ============================================================================
    // Individual rules
    // ============================================================================

    /** 16 above 100 GB, 12 above 50, 8 above 10, 4 above 1, otherwise 2. */
    public static int hashSubpartitionCount(double sizeGb) {
        if (sizeGb > HUGE_TABLE_GB) return 16;
        if (sizeGb > LARGE_TABLE_GB) return 12;
        if (sizeGb > MEDIUM_TABLE_GB) return 8;
        if (sizeGb > SMALL_TABLE_GB) return 4;
        return 2;
    }

    /**
     * Interval granularity from the daily row rate; without statistics, from size alone.
     */
    public static IntervalType intervalType(long rowCount, double sizeGb) {
        if (rowCount > 0) {
            double rowsPerDay = rowCount / DAYS_OF_DATA;
            if (rowsPerDay > ROWS_PER_DAY_HOURLY) return IntervalType.HOUR;
            if (rowsPerDay > ROWS_PER_DAY_DAILY) return IntervalType.DAY;
            return IntervalType.MONTH;
        }
        return sizeGb > HUGE_TABLE_GB ? IntervalType.DAY : IntervalType.MONTH;
    }

    /** 8 above 100 GB, 6 above 50, 4 above 10, otherwise 2. */
    public static int parallelDegree(double sizeGb) {
        if (sizeGb > HUGE_TABLE_GB) return 8;
        if (sizeGb > LARGE_TABLE_GB) return 6;
        if (sizeGb > MEDIUM_TABLE_GB) return 4;
        return 2;
    }

    /** {@code max(size/8, 0.1) + 0.75 per index}, rounded to one decimal. */
    public static double estimatedHours(double sizeGb, int indexCount) {
        double hours = Math.max(sizeGb / GB_PER_HOUR, MIN_HOURS) + indexCount * HOURS_PER_INDEX;
        return BigDecimal.valueOf(hours).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    public static Priority priority(double sizeGb, int lobCount) {
        if (sizeGb > LARGE_TABLE_GB) return Priority.HIGH;
        if (lobCount > 0 || sizeGb > MEDIUM_TABLE_GB) return Priority.MEDIUM;
        return Priority.LOW;
    }

    public static MigrationAction migrationAction(boolean isPartitioned, boolean isInterval, boolean hasSubpartitions) {
        if (!isPartitioned) return MigrationAction.ADD_INTERVAL_HASH_PARTITIONING;
        if (isInterval && !hasSubpartitions) return MigrationAction.ADD_HASH_SUBPARTITIONS;
        if (isInterval) return MigrationAction.CONVERT_INTERVAL_TO_INTERVAL_HASH;
        return MigrationAction.CONVERT_TO_INTERVAL_HASH;
    }

    /**
     * A table is worth migrating when it has a partition key candidate and a hash key candidate and
     * is not already INTERVAL-HASH.
     */
    public static boolean shouldEnable(AvailableColumns columns, boolean isInterval, boolean hasSubpartitions) {
        if (columns == null) return false;
        boolean hasTimestamp = !columns.timestampColumnNames().isEmpty();
        boolean hasHashKey = !columns.hashCandidateNames().isEmpty();
        return hasTimestamp && hasHashKey && !(isInterval && hasSubpartitions);
    }

    // ============================================================================
    // Whole-table recommendation
    // ============================================================================

    /**
     * Builds the recommended target and settings for one table. Tablespaces come from the environment;
     * counts and degrees come from the size rules above.
     */
    public static Recommendation recommend(TableProfile profile, EnvironmentProfile environment) {
        AvailableColumns columns = profile.getAvailableColumns();
        double sizeGb = profile.getSizeGb();

        String partitionColumn = firstPartitionKey(profile.getCurrentPartitionKey());
        if (partitionColumn == null && columns != null && !columns.timestampColumnNames().isEmpty()) {
            partitionColumn = columns.timestampColumnNames().get(0);
        }
        List<String> hashCandidates = columns == null ? List.of() : columns.hashCandidateNames();
        String subpartitionColumn = hashCandidates.isEmpty() ? null : hashCandidates.get(0);

        TargetConfiguration target = TargetConfiguration.builder()
                .partitionType(PartitionType.INTERVAL)
                .partitionColumn(partitionColumn)
                .intervalType(intervalType(profile.getRowCount(), sizeGb))
                .intervalValue(1)
                .initialPartitionValue(TargetConfiguration.DEFAULT_INITIAL_PARTITION_VALUE)
                .subpartitionType(subpartitionColumn != null ? SubpartitionType.HASH : SubpartitionType.NONE)
                .subpartitionColumn(subpartitionColumn)
                .subpartitionCount(hashSubpartitionCount(sizeGb))
                .tablespace(environment == null ? null : environment.primaryTablespace())
                .lobTablespaces(environment == null ? List.of() : environment.lobTablespaces())
                .parallelDegree(parallelDegree(sizeGb))
                .build();

        MigrationSettings settings = MigrationSettings.builder()
                .estimatedHours(estimatedHours(sizeGb, profile.getIndexCount()))
                .priority(priority(sizeGb, profile.getLobCount()))
                .build();

        MigrationAction action = migrationAction(
                profile.partitioned(), profile.intervalPartitioned(), profile.subpartitioned());
        boolean enabled = shouldEnable(columns, profile.intervalPartitioned(), profile.subpartitioned());

        log.debug("[RECOMMEND] size={} GB rows={} -> interval={} subpartitions={} parallel={} action={} enabled={}",
                sizeGb, profile.getRowCount(), target.getIntervalType(), target.getSubpartitionCount(),
                target.getParallelDegree(), action.getValue(), enabled);
        return new Recommendation(target, settings, action, enabled);
    }

    private static String firstPartitionKey(String currentPartitionKey) {
        if (currentPartitionKey == null || currentPartitionKey.isBlank()) return null;
        return currentPartitionKey.split(",")[0].trim();
    }
}
