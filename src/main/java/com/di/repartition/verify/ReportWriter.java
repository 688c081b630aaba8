package com.di.repartition.verify;

import com.di.repartition.config.RepartitionProperties;
import com.di.repartition.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered validation reports under {@code repartition.validation.report-directory}.
 * File names are relative to that directory and may not leave it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportWriter {

    public static final String DEFAULT_FILE_NAME = "validation_report.md";

    private final RepartitionProperties properties;

    public MigrationValidationReport write(MigrationValidationReport report, String fileName) {
        Path target = resolve(fileName);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, report.markdown(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write validation report to " + target, e);
        }
        log.info("[REPORT] Validation report saved to: {}", target);
        return report.withReportFile(target.toString());
    }

    /**
     * @throws IllegalArgumentException if the name is absolute or escapes the report directory
     */
    public Path resolve(String fileName) {
        String name = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
        return InputValidator.resolveWithin(properties.getValidation().getReportDirectory(), name, "Report file");
    }
}
