package com.di.repartition.verify;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a single named check. Details carry the values behind a WARN or FAIL and are rendered
 * as JSON under "Detailed Findings".
 */
public record CheckResult(
        String checkName,
        CheckStatus status,
        String message,
        Map<String, Object> details,
        LocalDateTime timestamp
) {

    public CheckResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static CheckResult pass(String checkName, String message) {
        return of(checkName, CheckStatus.PASS, message, null);
    }

    public static CheckResult pass(String checkName, String message, Map<String, Object> details) {
        return of(checkName, CheckStatus.PASS, message, details);
    }

    public static CheckResult warn(String checkName, String message) {
        return of(checkName, CheckStatus.WARN, message, null);
    }

    public static CheckResult warn(String checkName, String message, Map<String, Object> details) {
        return of(checkName, CheckStatus.WARN, message, details);
    }

    public static CheckResult fail(String checkName, String message) {
        return of(checkName, CheckStatus.FAIL, message, null);
    }

    public static CheckResult fail(String checkName, String message, Map<String, Object> details) {
        return of(checkName, CheckStatus.FAIL, message, details);
    }

    private static CheckResult of(String checkName, CheckStatus status, String message, Map<String, Object> details) {
        return new CheckResult(checkName, status, message, details, LocalDateTime.now());
    }

    public boolean hasDetails() {
        return !details.isEmpty();
    }
}
