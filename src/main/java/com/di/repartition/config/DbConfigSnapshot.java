package com.di.repartition.config;

/**
 * Immutable copy of the catalog connection settings used to build the pool.
 */
public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) {

    /** URL without any inline credentials, for logs and pool names. */
    public String sanitizedUrl() {
        if (jdbcUrl == null) return "null";
        // jdbc:oracle:thin:user/secret@host:1521/SVC -> jdbc:oracle:thin:@host:1521/SVC
        return jdbcUrl.replaceAll("thin:[^@/]+/[^@]+@", "thin:@");
    }

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + sanitizedUrl() + ", username=" + username
                + ", maximumPoolSize=" + maximumPoolSize + "]";
    }
}
