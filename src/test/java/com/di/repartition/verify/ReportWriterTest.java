package com.di.repartition.verify;

import com.di.repartition.config.RepartitionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReportWriter Tests")
class ReportWriterTest {

    @TempDir
    Path tempDir;

    private ReportWriter writer;
    private MigrationValidationReport report;

    @BeforeEach
    void setUp() {
        RepartitionProperties properties = new RepartitionProperties();
        properties.getValidation().setReportDirectory(tempDir.resolve("reports").toString());
        writer = new ReportWriter(properties);

        LocalDateTime now = LocalDateTime.now();
        MigrationValidationReport bare = new MigrationValidationReport("APP",
                List.of(CheckResult.pass("Table Exists: APP.ORDERS", "Table APP.ORDERS exists")), List.of(), List.of(),
                1, 1, 0, 0, now, now, null, null);
        report = bare.withMarkdown(ValidationReportRenderer.render(bare));
    }

    @Test
    @DisplayName("Should write the default file under the report directory")
    void testWrite_DefaultName() throws Exception {
        MigrationValidationReport written = writer.write(report, null);

        Path expected = tempDir.resolve("reports").resolve(ReportWriter.DEFAULT_FILE_NAME).toAbsolutePath().normalize();
        assertEquals(expected.toString(), written.reportFile());
        assertEquals(report.markdown(), Files.readString(expected, StandardCharsets.UTF_8));
        assertNull(report.reportFile());
    }

    @Test
    @DisplayName("Should create missing parent directories for a nested relative name")
    void testWrite_NestedRelativeName() {
        MigrationValidationReport written = writer.write(report, "2024/06/orders.md");

        assertTrue(Files.exists(Path.of(written.reportFile())));
        assertTrue(written.reportFile().endsWith("orders.md"));
    }

    @Test
    @DisplayName("Should keep names that step down and back up inside the report directory")
    void testWrite_DotSegmentsInside() {
        MigrationValidationReport written = writer.write(report, "2024/../orders.md");

        assertEquals(tempDir.resolve("reports").resolve("orders.md").toAbsolutePath().normalize().toString(),
                written.reportFile());
    }

    @Test
    @DisplayName("Should reject names that climb out of the report directory")
    void testWrite_RejectsParentTraversal() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> writer.write(report, "../../escaped.md"));

        assertTrue(ex.getMessage().contains("Report file"));
        assertFalse(Files.exists(tempDir.resolve("escaped.md")));
        assertFalse(Files.exists(tempDir.getParent().resolve("escaped.md")));
    }

    @Test
    @DisplayName("Should reject absolute paths, even inside the report directory")
    void testWrite_RejectsAbsolutePath() {
        Path outside = tempDir.resolve("elsewhere").resolve("report.md").toAbsolutePath();
        Path inside = tempDir.resolve("reports").resolve("report.md").toAbsolutePath();

        assertThrows(IllegalArgumentException.class, () -> writer.write(report, outside.toString()));
        assertThrows(IllegalArgumentException.class, () -> writer.write(report, inside.toString()));
        assertFalse(Files.exists(outside));
    }
}
