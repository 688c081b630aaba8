package com.di.repartition.discovery;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What to discover. Patterns are table-name globs ({@code *}, {@code ?}); include patterns are OR-ed,
 * exclude patterns AND-ed. The JDBC URL and user only feed the document metadata.
 */
@Value
@Builder
public class DiscoveryRequest {
    String schema;
    @Singular
    List<String> includePatterns;
    @Singular
    List<String> excludePatterns;
    String environment;
    String jdbcUrl;
    String user;
}
