package com.di.repartition.discovery;

import com.di.repartition.plan.model.TableMigrationPlan;

/**
 * Per-table discovery outcome. A skipped table still carries a partial plan (statistics gathered
 * before the failure, disabled) so it shows up in the document.
 */
public record TableAnalysis(String tableName, TableMigrationPlan plan, String skipReason) {

    public static TableAnalysis analyzed(TableMigrationPlan plan) {
        return new TableAnalysis(plan.getTableName(), plan, null);
    }

    public static TableAnalysis skipped(String tableName, String reason, TableMigrationPlan partialPlan) {
        return new TableAnalysis(tableName, partialPlan, reason);
    }

    public boolean skipped() {
        return skipReason != null;
    }
}
