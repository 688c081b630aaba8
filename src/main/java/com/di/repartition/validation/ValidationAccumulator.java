package com.di.repartition.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings of a single validation call, in the order the tiers report them.
 * Created fresh per call and never shared.
 */
final class ValidationAccumulator {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void error(String message) {
        errors.add(message);
    }

    void warn(String message) {
        warnings.add(message);
    }

    int errorCount() {
        return errors.size();
    }

    int warningCount() {
        return warnings.size();
    }

    ValidationOutcome toOutcome(boolean discoveryGenerated) {
        return new ValidationOutcome(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings), discoveryGenerated);
    }
}
