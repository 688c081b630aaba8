package com.di.repartition.verify;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one migration validation run produced: the per-suite results, the counters and the
 * rendered Markdown. {@code reportFile} is set only when the Markdown was also written to disk.
 */
public record MigrationValidationReport(
        String schema,
        List<CheckResult> preMigration,
        List<CheckResult> postMigration,
        List<CheckResult> dataComparison,
        int total,
        int passed,
        int warnings,
        int failed,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        String markdown,
        String reportFile
) {

    public MigrationValidationReport {
        preMigration = List.copyOf(preMigration);
        postMigration = List.copyOf(postMigration);
        dataComparison = List.copyOf(dataComparison);
    }

    /** All results in suite order: pre, post, data. */
    public List<CheckResult> allResults() {
        List<CheckResult> all = new ArrayList<>(preMigration);
        all.addAll(postMigration);
        all.addAll(dataComparison);
        return all;
    }

    public double durationSeconds() {
        if (startedAt == null || finishedAt == null) {
            return 0.0;
        }
        return Duration.between(startedAt, finishedAt).toMillis() / 1000.0;
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public MigrationValidationReport withMarkdown(String rendered) {
        return new MigrationValidationReport(schema, preMigration, postMigration, dataComparison,
                total, passed, warnings, failed, startedAt, finishedAt, rendered, reportFile);
    }

    public MigrationValidationReport withReportFile(String path) {
        return new MigrationValidationReport(schema, preMigration, postMigration, dataComparison,
                total, passed, warnings, failed, startedAt, finishedAt, markdown, path);
    }
}
