package com.di.repartition.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Single binding for the application's own settings.
 *
 * <pre>
 * repartition:
 *   database:
 *     url: jdbc:oracle:thin:@//db-host:1521/ORCLPDB1
 *     username: migration_ro
 *     password: ${REPARTITION_DB_PASSWORD:}
 *   discovery:
 *     output-directory: plans
 *   environment:
 *     active: global
 *     profile-file: classpath:environments.yml
 *   session:
 *     query-timeout-seconds: 60
 *   validation:
 *     report-directory: validation-reports
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "repartition")
public class RepartitionProperties {

    private Database database = new Database();
    private Discovery discovery = new Discovery();
    private Environment environment = new Environment();
    private Session session = new Session();
    @Valid
    private Validation validation = new Validation();

    // ------------------------------------------------------------------ //
    // Catalog connection (read-only user is enough)                       //
    // ------------------------------------------------------------------ //

    @Data
    public static class Database {
        /** Oracle thin URL. Blank = no database; discovery and live checks are unavailable. */
        private String url = "";
        private String username = "";
        private String password = "";
        private String driverClassName = "oracle.jdbc.OracleDriver";
        private int maximumPoolSize = 4;
        private int minimumIdle = 0;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }

        public DbConfigSnapshot toSnapshot() {
            return new DbConfigSnapshot(url, username, password, driverClassName,
                    maximumPoolSize, minimumIdle, idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
        }
    }

    // ------------------------------------------------------------------ //
    // Environment profiles                                                //
    // ------------------------------------------------------------------ //

    @Data
    public static class Environment {
        /** Environment used when a request does not name one. */
        private String active = "global";
        /** YAML file holding {@code environments.<name>} overrides (classpath: or file path). */
        private String profileFile = "classpath:environments.yml";
    }

    @Data
    public static class Discovery {
        /** Directory that receives plan documents written over HTTP; names may not leave it. */
        private String outputDirectory = "plans";
    }

    @Data
    public static class Session {
        /** Per-statement timeout; expiry fails only the table or check that issued the query. 0 = none. */
        private int queryTimeoutSeconds = 60;
    }

    @Data
    public static class Validation {
        private String reportDirectory = "validation-reports";
        /** Keys sampled from the old table by the sample data comparison; one Oracle IN list at most. */
        @Min(1)
        @Max(1000)
        private int sampleSize = 1000;
    }
}
