package com.di.repartition.environment;

/**
 * Environment profile file exists but cannot be parsed or bound.
 */
public class EnvironmentConfigException extends RuntimeException {

    public EnvironmentConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
