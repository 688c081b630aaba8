package com.di.repartition.plan;

/**
 * The plan document does not carry a valid discovery provenance hash and no override was given.
 */
public class ProvenanceException extends RuntimeException {

    public ProvenanceException(String message) {
        super(message);
    }
}
