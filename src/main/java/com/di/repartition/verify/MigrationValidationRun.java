package com.di.repartition.verify;

import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the results of one migration validation run. Created per call by
 * {@link MigrationValidator#openRun}; not thread-safe and not reusable across runs.
 */
@Slf4j
public class MigrationValidationRun {

    private final String schema;
    private final PreMigrationChecks preChecks;
    private final PostMigrationChecks postChecks;
    private final DataComparisonChecks dataChecks;

    private final List<CheckResult> preMigration = new ArrayList<>();
    private final List<CheckResult> postMigration = new ArrayList<>();
    private final List<CheckResult> dataComparison = new ArrayList<>();
    private final LocalDateTime startedAt = LocalDateTime.now();

    private int total;
    private int passed;
    private int warnings;
    private int failed;

    MigrationValidationRun(MigrationPlanDocument document, SqlQueriesProperties.Verify sql, QuerySession session, int sampleSize) {
        this.schema = document.getMetadata() == null ? null : document.getMetadata().effectiveSchema();
        this.preChecks = new PreMigrationChecks(sql, session, document.getEnvironmentConfig());
        this.postChecks = new PostMigrationChecks(sql, session);
        this.dataChecks = new DataComparisonChecks(sql, session, sampleSize);
    }

    public List<CheckResult> validatePreMigration(TableMigrationPlan plan) {
        log.info("[MIGRATION-CHECK] Pre-migration checks: {}", plan.qualifiedName());
        return record(preChecks.run(plan), preMigration, "Pre-migration", plan);
    }

    public List<CheckResult> validatePostMigration(TableMigrationPlan plan) {
        log.info("[MIGRATION-CHECK] Post-migration checks: {}.{}", plan.getOwner(), plan.newTableName());
        return record(postChecks.run(plan), postMigration, "Post-migration", plan);
    }

    public List<CheckResult> compareData(TableMigrationPlan plan) {
        log.info("[MIGRATION-CHECK] Data comparison: {} vs {}", plan.getTableName(), plan.newTableName());
        return record(dataChecks.run(plan), dataComparison, "Data comparison", plan);
    }

    /** Snapshot of everything recorded so far, with the Markdown rendered. */
    public MigrationValidationReport report() {
        MigrationValidationReport report = new MigrationValidationReport(schema, preMigration, postMigration, dataComparison,
                total, passed, warnings, failed, startedAt, LocalDateTime.now(), null, null);
        return report.withMarkdown(ValidationReportRenderer.render(report));
    }

    private List<CheckResult> record(List<CheckResult> results, List<CheckResult> suite, String phase, TableMigrationPlan plan) {
        suite.addAll(results);
        int suitePassed = 0, suiteWarnings = 0, suiteFailed = 0;
        for (CheckResult result : results) {
            total++;
            switch (result.status()) {
                case PASS -> { passed++; suitePassed++; }
                case WARN -> { warnings++; suiteWarnings++; }
                case FAIL -> { failed++; suiteFailed++; }
            }
            if (result.status() != CheckStatus.PASS) {
                log.warn("[MIGRATION-CHECK] {} [{}] {}: {}", plan.getTableName(), result.status(), result.checkName(), result.message());
            }
        }
        log.info("[MIGRATION-CHECK] {} {}: {} passed, {} warnings, {} failed",
                phase, plan.getTableName(), suitePassed, suiteWarnings, suiteFailed);
        return results;
    }

    public int getTotal() { return total; }
    public int getPassed() { return passed; }
    public int getWarnings() { return warnings; }
    public int getFailed() { return failed; }
}
