package com.di.repartition.verify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValidationReportRenderer Tests")
class ValidationReportRendererTest {

    private static final LocalDateTime STARTED = LocalDateTime.of(2024, 6, 1, 10, 0, 0);
    private static final LocalDateTime FINISHED = LocalDateTime.of(2024, 6, 1, 10, 0, 12, 500_000_000);

    private static MigrationValidationReport report(String schema, List<CheckResult> pre, List<CheckResult> post,
                                                    List<CheckResult> data) {
        List<CheckResult> all = new ArrayList<>(pre);
        all.addAll(post);
        all.addAll(data);
        int passed = (int) all.stream().filter(r -> r.status() == CheckStatus.PASS).count();
        int warnings = (int) all.stream().filter(r -> r.status() == CheckStatus.WARN).count();
        int failed = (int) all.stream().filter(r -> r.status() == CheckStatus.FAIL).count();
        return new MigrationValidationReport(schema, pre, post, data, all.size(), passed, warnings, failed,
                STARTED, FINISHED, null, null);
    }

    @Test
    @DisplayName("Should render header, summary and all sections in order")
    void testRender_Layout() {
        MigrationValidationReport report = report("APP",
                List.of(CheckResult.pass("Table Exists: APP.ORDERS", "Table APP.ORDERS exists")),
                List.of(),
                List.of(CheckResult.warn("Total Row Count", "Row counts could not be read")));

        String md = ValidationReportRenderer.render(report);

        assertTrue(md.startsWith("# Migration Validation Report\n\n**Generated:** 2024-06-01 10:00:12  \n"));
        assertTrue(md.contains("**Duration:** 12.5 seconds  \n"));
        assertTrue(md.contains("**Schema:** APP\n\n"));
        assertTrue(md.contains("| ✓ Passed | 1 |\n| ⚠ Warnings | 1 |\n| ✗ Failed | 0 |\n| **Total** | **2** |"));
        assertTrue(md.contains("| ✓ PASS | Table Exists: APP.ORDERS | Table APP.ORDERS exists |"));
        assertTrue(md.contains("## Post-Migration Validation\n\n*No checks performed*"));
        assertTrue(md.contains("| ⚠ WARN | Total Row Count | Row counts could not be read |"));
        assertTrue(md.contains("## Detailed Findings\n\n*No detailed findings*"));
        assertTrue(md.contains("- **CAUTION:** 1 warning(s) found. Review before proceeding."));
        assertTrue(md.endsWith(ValidationReportRenderer.FOOTER + "\n"));

        int pre = md.indexOf("## Pre-Migration Checks");
        int post = md.indexOf("## Post-Migration Validation");
        int data = md.indexOf("## Data Comparison");
        int findings = md.indexOf("## Detailed Findings");
        int recommendations = md.indexOf("## Recommendations");
        assertTrue(pre < post && post < data && data < findings && findings < recommendations);
    }

    @Test
    @DisplayName("Should show N/A for a missing schema")
    void testRender_NoSchema() {
        String md = ValidationReportRenderer.render(report(" ", List.of(), List.of(), List.of()));
        assertTrue(md.contains("**Schema:** N/A"));
        assertTrue(md.contains("- ✓ All checks passed. Migration appears successful."));
    }

    @Test
    @DisplayName("Should flatten newlines and cut table messages at 100 characters")
    void testTableMessage() {
        assertEquals("Found 2 partition(s)<br>  - P1: 10 rows", ValidationReportRenderer.tableMessage("Found 2 partition(s)\n  - P1: 10 rows"));
        String longMessage = "x".repeat(150);
        assertEquals(100, ValidationReportRenderer.tableMessage(longMessage).length());
        assertEquals("", ValidationReportRenderer.tableMessage(null));
    }

    @Test
    @DisplayName("Should list non-passing results with details as two-space JSON")
    void testDetailedFindings() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("free_gb", 4.0);
        details.put("required_gb", 10.0);
        details.put("missing", null);
        List<CheckResult> results = List.of(
                CheckResult.pass("Indexes Created", "Created 2 index(es)", Map.of("index_count", 2)),
                CheckResult.warn("Constraints Enabled", "No constraints found"),
                CheckResult.warn("Tablespace Space", "Tablespace USERS has 4.00 GB free, but 10.00 GB recommended", details));

        String findings = ValidationReportRenderer.detailedFindings(results);

        assertEquals(String.join("\n",
                "### Tablespace Space",
                "**Status:** WARN",
                "**Message:** Tablespace USERS has 4.00 GB free, but 10.00 GB recommended",
                "**Details:**",
                "```json",
                "{",
                "  \"free_gb\": 4.0,",
                "  \"required_gb\": 10.0,",
                "  \"missing\": null",
                "}",
                "```",
                ""), findings);
    }

    @Test
    @DisplayName("Should add one targeted recommendation per kind of failure")
    void testRecommendations() {
        List<CheckResult> results = List.of(
                CheckResult.fail("Row Count Match", "Row count mismatch: Old=10, New=9, Diff=1 (10.00%)"),
                CheckResult.fail("Total Row Count", "Row count mismatch: Old=10, New=9"),
                CheckResult.fail("Partition Type", "Partition type is RANGE, expected INTERVAL"),
                CheckResult.warn("Indexes Created", "No indexes found on new table"));

        String recommendations = ValidationReportRenderer.recommendations(results);

        assertEquals(String.join("\n",
                "- **CRITICAL:** 3 check(s) failed. Do not proceed with migration until resolved.",
                "- **CAUTION:** 1 warning(s) found. Review before proceeding.",
                "- Investigate row count discrepancy before swapping tables",
                "- Verify partition configuration in generated scripts"), recommendations);
    }

    @Test
    @DisplayName("Should keep null detail values and reject later mutation")
    void testCheckResult_Details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("interval", null);
        CheckResult result = CheckResult.warn("Existing Partitions", "Current: RANGE partitioning", details);
        details.put("added", 1);

        assertTrue(result.hasDetails());
        assertEquals(1, result.details().size());
        assertThrows(UnsupportedOperationException.class, () -> result.details().put("x", 1));
        assertFalse(CheckResult.pass("a", "b").hasDetails());
        assertEquals("✗ FAIL", CheckStatus.FAIL.label());
    }
}
