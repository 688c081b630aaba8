package com.di.repartition.discovery;

import com.di.repartition.plan.model.MigrationPlanDocument;

import java.util.List;

/**
 * Discovery output: the plan document, one analysis per table in document order, the per-table
 * warnings and a one-line summary.
 */
public record DiscoveryResult(
        MigrationPlanDocument document,
        List<TableAnalysis> analyses,
        List<String> warnings,
        String summary
) {

    public long skippedCount() {
        return analyses.stream().filter(TableAnalysis::skipped).count();
    }
}
