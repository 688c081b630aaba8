package com.di.repartition.validation;

import java.util.List;

/**
 * Result of one {@link ConfigValidator#validate} call. {@code discoveryGenerated} is informational and
 * never affects {@code valid}.
 */
public record ValidationOutcome(boolean valid, List<String> errors, List<String> warnings, boolean discoveryGenerated) {}
