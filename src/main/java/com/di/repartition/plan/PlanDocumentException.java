package com.di.repartition.plan;

/**
 * A plan document could not be read, parsed or written. Unknown enum values and malformed JSON
 * surface here, at the deserialization boundary.
 */
public class PlanDocumentException extends RuntimeException {

    public PlanDocumentException(String message) {
        super(message);
    }

    public PlanDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
