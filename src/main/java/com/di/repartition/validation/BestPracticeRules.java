package com.di.repartition.validation;

import com.di.repartition.plan.model.IntervalType;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.MigrationSettings;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TableProfile;
import com.di.repartition.plan.model.TargetConfiguration;

import java.util.Locale;

/**
 * Sizing heuristics for enabled tables. Warnings only.
 */
final class BestPracticeRules {

    private BestPracticeRules() {}

    static void apply(MigrationPlanDocument document, ValidationAccumulator acc) {
        for (TableMigrationPlan table : LogicalRules.tablesOf(document)) {
            if (table != null && table.isEnabled()) {
                checkTable(table, acc);
            }
        }
    }

    private static void checkTable(TableMigrationPlan table, ValidationAccumulator acc) {
        String prefix = "Table " + table.getTableName();
        TableProfile current = table.getCurrentState();
        TargetConfiguration target = table.target();
        MigrationSettings settings = table.settings();

        double sizeGb = current == null ? 0 : current.getSizeGb();
        long rowCount = current == null ? 0 : current.getRowCount();
        int lobCount = current == null ? 0 : current.getLobCount();
        int parallel = target == null || target.getParallelDegree() == null ? 1 : target.getParallelDegree();
        int subpartitions = target == null || target.getSubpartitionCount() == null ? 0 : target.getSubpartitionCount();

        if (sizeGb > 50 && parallel < 4) {
            acc.warn(format("%s: Large table (%.1f GB) with low parallel degree (%d)", prefix, sizeGb, parallel));
        }
        if (sizeGb < 1 && parallel > 2) {
            acc.warn(format("%s: Small table (%.1f GB) with high parallel degree (%d)", prefix, sizeGb, parallel));
        }
        if (sizeGb > 100 && subpartitions < 8) {
            acc.warn(format("%s: Very large table (%.1f GB) may benefit from more subpartitions (current: %d, consider: 16)",
                    prefix, sizeGb, subpartitions));
        }
        if (sizeGb < 1 && subpartitions > 4) {
            acc.warn(format("%s: Small table (%.1f GB) with many subpartitions (%d) may cause overhead",
                    prefix, sizeGb, subpartitions));
        }
        if (lobCount > 0) {
            acc.warn(format("%s: Table has %d LOB column(s) - ensure LOB storage is properly configured", prefix, lobCount));
        }
        if (settings != null) {
            if (sizeGb > 50 && !settings.isValidateData()) {
                acc.warn(prefix + ": Large table without data validation enabled");
            }
            if (!settings.isBackupOldTable()) {
                acc.warn(prefix + ": Old table backup disabled - no rollback possible");
            }
        }
        if (rowCount > 10_000_000 && target != null && target.getIntervalType() == IntervalType.MONTH) {
            acc.warn(format("%s: High row count (%,d) with MONTH interval - consider DAY or HOUR for better performance",
                    prefix, rowCount));
        }
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
