package com.di.repartition.validation;

import com.di.repartition.plan.ProvenanceVerifier;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validates a plan document in four tiers: structural, logical, live database (optional) and best
 * practice. Every tier runs; errors and warnings accumulate in a fresh accumulator per call, so the
 * bean itself holds no per-call state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigValidator {

    public static final String NO_SESSION_WARNING = "Database validation requested but no connection provided";

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

    private final Validator validator;
    private final SqlQueriesProperties sql;

    public ValidationOutcome validate(MigrationPlanDocument document, boolean checkDatabase) {
        return validate(document, checkDatabase, null);
    }

    /**
     * @param session live session for tier 3; null skips it with a warning when {@code checkDatabase} is set
     */
    public ValidationOutcome validate(MigrationPlanDocument document, boolean checkDatabase, QuerySession session) {
        ValidationAccumulator acc = new ValidationAccumulator();
        if (document == null) {
            acc.error("Structural: document: must not be null");
            return acc.toOutcome(false);
        }

        validateStructure(document, acc);
        LogicalRules.apply(document, acc);
        if (checkDatabase) {
            if (session != null) {
                new LiveDatabaseRules(sql.getValidation(), session).apply(document, acc);
            } else {
                acc.warn(NO_SESSION_WARNING);
            }
        }
        BestPracticeRules.apply(document, acc);

        boolean discoveryGenerated = ProvenanceVerifier.isDiscoveryGenerated(document);
        ValidationOutcome outcome = acc.toOutcome(discoveryGenerated);
        log.info("[CONFIG-VALIDATE] {}: {} table(s), {} error(s), {} warning(s), discovery-generated={}",
                outcome.valid() ? "VALID" : "INVALID", LogicalRules.tablesOf(document).size(),
                acc.errorCount(), acc.warningCount(), discoveryGenerated);
        return outcome;
    }

    // ------------------------------------------------------------------ //
    // Tier 1: structural                                                  //
    // ------------------------------------------------------------------ //

    private void validateStructure(MigrationPlanDocument document, ValidationAccumulator acc) {
        Set<ConstraintViolation<MigrationPlanDocument>> violations = validator.validate(document);
        violations.stream()
                .map(v -> jsonPath(v.getPropertyPath().toString()) + ": " + v.getMessage())
                .sorted(Comparator.naturalOrder())
                .forEach(message -> acc.error("Structural: " + message));

        Set<String> seen = new HashSet<>();
        List<String> duplicates = LogicalRules.tablesOf(document).stream()
                .filter(t -> t != null && t.getTableName() != null)
                .map(TableMigrationPlan::getTableName)
                .filter(name -> !seen.add(name.toUpperCase(Locale.ROOT)))
                .distinct()
                .collect(Collectors.toList());
        duplicates.forEach(name -> acc.error("Duplicate table name: " + name));
    }

    /** {@code tables[0].commonSettings.targetConfiguration} → {@code tables[0].common_settings.target_configuration}. */
    static String jsonPath(String propertyPath) {
        return CAMEL_BOUNDARY.matcher(propertyPath).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    }
}
