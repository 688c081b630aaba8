package com.di.repartition.verify;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renders a {@link MigrationValidationReport} as the Markdown document operators review before
 * swapping tables.
 */
public final class ValidationReportRenderer {

    static final int MAX_MESSAGE_LENGTH = 100;
    static final String FOOTER = "*Report generated by Migration Validator v1.0*";

    private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "---";
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private ValidationReportRenderer() {
        // utility class
    }

    public static String render(MigrationValidationReport report) {
        List<CheckResult> all = report.allResults();
        String generated = report.finishedAt() == null ? "N/A" : report.finishedAt().format(GENERATED_FORMAT);
        String schema = report.schema() == null || report.schema().isBlank() ? "N/A" : report.schema();

        StringBuilder md = new StringBuilder();
        md.append("# Migration Validation Report\n\n");
        md.append("**Generated:** ").append(generated).append("  \n");
        md.append(String.format(Locale.ROOT, "**Duration:** %.1f seconds  \n", report.durationSeconds()));
        md.append("**Schema:** ").append(schema).append("\n\n");
        md.append(RULE).append("\n\n");

        md.append("## Summary\n\n");
        md.append("| Status | Count |\n");
        md.append("|--------|-------|\n");
        md.append("| ").append(CheckStatus.PASS.getSymbol()).append(" Passed | ").append(report.passed()).append(" |\n");
        md.append("| ").append(CheckStatus.WARN.getSymbol()).append(" Warnings | ").append(report.warnings()).append(" |\n");
        md.append("| ").append(CheckStatus.FAIL.getSymbol()).append(" Failed | ").append(report.failed()).append(" |\n");
        md.append("| **Total** | **").append(report.total()).append("** |\n\n");

        section(md, "Pre-Migration Checks", resultsTable(report.preMigration()));
        section(md, "Post-Migration Validation", resultsTable(report.postMigration()));
        section(md, "Data Comparison", resultsTable(report.dataComparison()));
        section(md, "Detailed Findings", detailedFindings(all));
        section(md, "Recommendations", recommendations(all));

        md.append(FOOTER).append("\n");
        return md.toString();
    }

    private static void section(StringBuilder md, String title, String body) {
        md.append(RULE).append("\n\n");
        md.append("## ").append(title).append("\n\n");
        md.append(body).append("\n\n");
    }

    static String resultsTable(List<CheckResult> results) {
        if (results.isEmpty()) {
            return "*No checks performed*";
        }
        List<String> lines = new ArrayList<>();
        lines.add("| Status | Check | Message |");
        lines.add("|--------|-------|---------|");
        for (CheckResult result : results) {
            lines.add("| " + result.status().label() + " | " + result.checkName() + " | " + tableMessage(result.message()) + " |");
        }
        return String.join("\n", lines);
    }

    /** Newlines become {@code <br>}; the result is cut to the first 100 characters. */
    static String tableMessage(String message) {
        String flat = message == null ? "" : message.replace("\n", "<br>");
        return flat.length() > MAX_MESSAGE_LENGTH ? flat.substring(0, MAX_MESSAGE_LENGTH) : flat;
    }

    static String detailedFindings(List<CheckResult> results) {
        List<String> findings = new ArrayList<>();
        for (CheckResult result : results) {
            if (result.status() == CheckStatus.PASS || !result.hasDetails()) {
                continue;
            }
            findings.add("### " + result.checkName());
            findings.add("**Status:** " + result.status());
            findings.add("**Message:** " + result.message());
            findings.add("**Details:**");
            findings.add("```json");
            findings.add(prettyJson(result));
            findings.add("```");
            findings.add("");
        }
        return findings.isEmpty() ? "*No detailed findings*" : String.join("\n", findings);
    }

    static String recommendations(List<CheckResult> results) {
        long failed = results.stream().filter(r -> r.status() == CheckStatus.FAIL).count();
        long warnings = results.stream().filter(r -> r.status() == CheckStatus.WARN).count();

        Set<String> lines = new LinkedHashSet<>();
        if (failed > 0) {
            lines.add("- **CRITICAL:** " + failed + " check(s) failed. Do not proceed with migration until resolved.");
        }
        if (warnings > 0) {
            lines.add("- **CAUTION:** " + warnings + " warning(s) found. Review before proceeding.");
        }
        for (CheckResult result : results) {
            if (result.status() != CheckStatus.FAIL) {
                continue;
            }
            if (result.message() != null && result.message().contains("Row count mismatch")) {
                lines.add("- Investigate row count discrepancy before swapping tables");
            } else if (result.checkName().toLowerCase(Locale.ROOT).contains("partition type")) {
                lines.add("- Verify partition configuration in generated scripts");
            }
        }
        if (lines.isEmpty()) {
            lines.add("- " + CheckStatus.PASS.getSymbol() + " All checks passed. Migration appears successful.");
        }
        return String.join("\n", lines);
    }

    private static String prettyJson(CheckResult result) {
        try {
            return JSON_MAPPER.writer(new TwoSpacePrettyPrinter()).writeValueAsString(result.details());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render details of check " + result.checkName(), e);
        }
    }

    /** Two-space indentation with {@code "key": value} spacing and one array element per line. */
    private static final class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {

        TwoSpacePrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TwoSpacePrettyPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
