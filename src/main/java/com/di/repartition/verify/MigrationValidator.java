package com.di.repartition.verify;

import com.di.repartition.config.RepartitionProperties;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.session.QuerySession;
import com.di.repartition.session.QuerySessionFactory;
import com.di.repartition.sql.SqlQueriesProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entry point for pre-migration, post-migration and data comparison checks. Each call works on its
 * own {@link MigrationValidationRun}; a connectivity loss propagates out of every method here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationValidator {

    private final SqlQueriesProperties sql;
    private final RepartitionProperties properties;
    private final QuerySessionFactory sessionFactory;

    public MigrationValidationRun openRun(MigrationPlanDocument document, QuerySession session) {
        return new MigrationValidationRun(document, sql.getVerify(), session, properties.getValidation().getSampleSize());
    }

    /** Opens a session from the pool for the duration of the run. */
    public MigrationValidationReport validate(MigrationPlanDocument document, Set<Phase> phases, String tableFilter) {
        try (QuerySession session = sessionFactory.open()) {
            return validate(document, session, phases, tableFilter);
        }
    }

    /**
     * Runs the requested phases, in PRE, POST, DATA order, for every enabled table, or only for
     * {@code tableFilter} when one is given.
     *
     * @throws IllegalArgumentException when {@code tableFilter} names a table the document does not hold
     */
    public MigrationValidationReport validate(MigrationPlanDocument document, QuerySession session,
                                              Set<Phase> phases, String tableFilter) {
        Set<Phase> selected = phases == null || phases.isEmpty() ? EnumSet.allOf(Phase.class) : EnumSet.copyOf(phases);
        List<TableMigrationPlan> tables = selectTables(document, tableFilter);
        log.info("[MIGRATION-CHECK] Validating {} table(s), phases {}", tables.size(), selected);

        MigrationValidationRun run = openRun(document, session);
        for (TableMigrationPlan table : tables) {
            if (selected.contains(Phase.PRE)) run.validatePreMigration(table);
            if (selected.contains(Phase.POST)) run.validatePostMigration(table);
            if (selected.contains(Phase.DATA)) run.compareData(table);
        }

        MigrationValidationReport report = run.report();
        log.info("[MIGRATION-CHECK] Done: {} check(s), {} passed, {} warnings, {} failed in {}s",
                report.total(), report.passed(), report.warnings(), report.failed(),
                String.format(Locale.ROOT, "%.1f", report.durationSeconds()));
        return report;
    }

    static List<TableMigrationPlan> selectTables(MigrationPlanDocument document, String tableFilter) {
        if (tableFilter == null || tableFilter.isBlank()) {
            return document.enabledTables();
        }
        return document.findTable(tableFilter.trim())
                .map(List::of)
                .orElseThrow(() -> new IllegalArgumentException("Table " + tableFilter + " not found in configuration"));
    }
}
