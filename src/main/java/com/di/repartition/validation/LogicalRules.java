package com.di.repartition.validation;

import com.di.repartition.plan.model.AvailableColumns;
import com.di.repartition.plan.model.EnvironmentProfile;
import com.di.repartition.plan.model.MigrationAction;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.PlanMetadata;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TableProfile;
import com.di.repartition.plan.model.TargetConfiguration;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-table consistency rules that need nothing but the document itself.
 */
final class LogicalRules {

    static final int MAX_SUBPARTITIONS = 1024;

    /** {@code TO_DATE('2024-01-01', 'YYYY-MM-DD')}, also TO_TIMESTAMP. */
    private static final Pattern INITIAL_PARTITION_VALUE = Pattern.compile(
            "^TO_(DATE|TIMESTAMP)\\('[\\d\\-/ :.]+',\\s*'[A-Z0-9\\-/ :.]+'\\)$", Pattern.CASE_INSENSITIVE);

    private LogicalRules() {}

    static void apply(MigrationPlanDocument document, ValidationAccumulator acc) {
        checkMetadataCounts(document, acc);
        for (TableMigrationPlan table : tablesOf(document)) {
            if (table != null) {
                checkTable(table, document.getEnvironmentConfig(), acc);
            }
        }
    }

    /** Hand-pruned documents are expected, so count drift only warns. */
    private static void checkMetadataCounts(MigrationPlanDocument document, ValidationAccumulator acc) {
        PlanMetadata metadata = document.getMetadata();
        List<TableMigrationPlan> tables = tablesOf(document);
        int totalFound = metadata == null || metadata.getTotalTablesFound() == null ? 0 : metadata.getTotalTablesFound();
        int selected = metadata == null || metadata.getTablesSelectedForMigration() == null ? 0 : metadata.getTablesSelectedForMigration();
        long enabled = tables.stream().filter(t -> t != null && t.isEnabled()).count();
        if (tables.size() != totalFound) {
            acc.warn(String.format("Metadata says %d tables found, but config has %d tables", totalFound, tables.size()));
        }
        if (enabled != selected) {
            acc.warn(String.format("Metadata says %d tables selected, but %d are enabled", selected, enabled));
        }
    }

    private static void checkTable(TableMigrationPlan table, EnvironmentProfile environment, ValidationAccumulator acc) {
        String prefix = "Table " + table.getTableName();
        TargetConfiguration target = table.target();
        TableProfile current = table.getCurrentState();
        if (target == null) {
            return;
        }
        AvailableColumns available = current == null || current.getAvailableColumns() == null
                ? AvailableColumns.builder().build()
                : current.getAvailableColumns();

        String partitionColumn = target.getPartitionColumn();
        if (partitionColumn != null && !partitionColumn.isBlank()) {
            if (!available.timestampColumnNames().contains(partitionColumn)) {
                acc.error(String.format("%s: partition_column '%s' not in available timestamp columns", prefix, partitionColumn));
            }
        } else if (target.getPartitionType() == PartitionType.INTERVAL) {
            acc.error(prefix + ": partition_column required for INTERVAL partitioning");
        }

        String subpartitionColumn = target.getSubpartitionColumn();
        if (subpartitionColumn != null && !subpartitionColumn.isBlank() && target.hashSubpartitioned()
                && !available.hashCandidateNames().contains(subpartitionColumn)) {
            acc.error(String.format("%s: subpartition_column '%s' not in available columns", prefix, subpartitionColumn));
        }

        int intervalValue = target.getIntervalValue() == null ? 1 : target.getIntervalValue();
        if (target.getIntervalType() != null && intervalValue < 1) {
            acc.error(prefix + ": interval_value must be >= 1");
        }

        Integer count = target.getSubpartitionCount();
        if (count != null) {
            if (count > MAX_SUBPARTITIONS) {
                acc.error(String.format("%s: subpartition_count %d exceeds maximum (%d)", prefix, count, MAX_SUBPARTITIONS));
            } else if (count < 1) {
                if (target.hashSubpartitioned()) {
                    acc.error(String.format("%s: subpartition_count %d is below minimum (1)", prefix, count));
                }
            } else if (!isPowerOfTwo(count)) {
                acc.warn(String.format("%s: subpartition_count %d is not a power of 2 (recommended: 2, 4, 8, 16, 32, ...)", prefix, count));
            }
        }

        checkActionConsistency(prefix, table.action(), current, acc);

        String initial = target.getInitialPartitionValue();
        if (!isValidInitialPartitionValue(initial)) {
            acc.error(String.format("%s: initial_partition_value must be Oracle TO_DATE format, got: %s", prefix, initial));
        }

        checkEnvironmentBounds(prefix, target, environment, acc);
    }

    private static void checkActionConsistency(String prefix, MigrationAction action, TableProfile current, ValidationAccumulator acc) {
        if (current == null || action == null) {
            return;
        }
        if (action == MigrationAction.ADD_INTERVAL_HASH_PARTITIONING && current.partitioned()) {
            acc.warn(prefix + ": action is 'add_interval_hash_partitioning' but table is already partitioned");
        }
        if (action == MigrationAction.ADD_HASH_SUBPARTITIONS && current.subpartitioned()) {
            acc.warn(prefix + ": action is 'add_hash_subpartitions' but table already has subpartitions");
        }
    }

    private static void checkEnvironmentBounds(String prefix, TargetConfiguration target, EnvironmentProfile environment,
                                               ValidationAccumulator acc) {
        if (environment == null) {
            return;
        }
        Integer count = target.getSubpartitionCount();
        EnvironmentProfile.SubpartitionDefaults sub = environment.getSubpartitionDefaults();
        if (count != null && count >= 1 && count <= MAX_SUBPARTITIONS && sub != null) {
            int min = sub.getMinCount() == null ? 2 : sub.getMinCount();
            int max = sub.getMaxCount() == null ? 16 : sub.getMaxCount();
            if (count < min) {
                acc.warn(String.format("%s: subpartition_count %d below environment minimum %d", prefix, count, min));
            } else if (count > max) {
                acc.warn(String.format("%s: subpartition_count %d above environment maximum %d", prefix, count, max));
            }
        }

        Integer degree = target.getParallelDegree();
        EnvironmentProfile.ParallelDefaults parallel = environment.getParallelDefaults();
        if (degree != null && parallel != null) {
            int min = parallel.getMinDegree() == null ? 1 : parallel.getMinDegree();
            int max = parallel.getMaxDegree() == null ? 8 : parallel.getMaxDegree();
            if (degree < min) {
                acc.warn(String.format("%s: parallel_degree %d below environment minimum %d", prefix, degree, min));
            } else if (degree > max) {
                acc.warn(String.format("%s: parallel_degree %d above environment maximum %d", prefix, degree, max));
            }
        }

        String tablespace = target.getTablespace();
        String primary = environment.primaryTablespace();
        if (tablespace != null && primary != null && !tablespace.equalsIgnoreCase(primary)) {
            acc.warn(String.format("%s: tablespace %s differs from environment default %s", prefix, tablespace, primary));
        }
    }

    static List<TableMigrationPlan> tablesOf(MigrationPlanDocument document) {
        return document.getTables() == null ? List.of() : document.getTables();
    }

    static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    static boolean isValidInitialPartitionValue(String value) {
        return value != null && INITIAL_PARTITION_VALUE.matcher(value.trim()).matches();
    }
}
