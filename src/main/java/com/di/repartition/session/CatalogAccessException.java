package com.di.repartition.session;

/**
 * The database session is gone (connection refused, closed or reset). Fatal to the running
 * discovery or validation operation; every other query failure is handled per table or per check.
 */
public class CatalogAccessException extends RuntimeException {

    public CatalogAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
