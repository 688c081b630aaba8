package com.di.repartition.plan.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where a plan document was discovered from. Never carries credentials.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConnectionDetails {

    public static final String UNKNOWN = "Unknown";

    /** {@code //host:port/service} (EZConnect) or {@code host:port/service}. */
    private static final Pattern SERVICE_NAME = Pattern.compile("^(?://)?([^:/]+):(\\d+)/([^?\\s]+)$");
    /** {@code host:port:SID}. */
    private static final Pattern SID = Pattern.compile("^([^:/]+):(\\d+):([^?\\s]+)$");

    /** {@code Service Name}, {@code SID}, {@code Easy Connect} or {@code Unknown}. */
    String type;
    String host;
    String port;
    String service;
    String user;

    /**
     * Parses an Oracle thin JDBC URL ({@code jdbc:oracle:thin:@...}). Anything that does not look like
     * host/port/service yields {@code Unknown} fields.
     */
    public static ConnectionDetails fromJdbcUrl(String jdbcUrl, String user) {
        String effectiveUser = user == null || user.isBlank() ? UNKNOWN : user;
        if (jdbcUrl == null || !jdbcUrl.contains("@")) {
            return unknown(effectiveUser);
        }
        String target = jdbcUrl.substring(jdbcUrl.indexOf('@') + 1).trim();
        Matcher m = SERVICE_NAME.matcher(target);
        if (m.matches()) {
            String type = target.startsWith("//") ? "Easy Connect" : "Service Name";
            return new ConnectionDetails(type, m.group(1), m.group(2), m.group(3), effectiveUser);
        }
        m = SID.matcher(target);
        if (m.matches()) {
            return new ConnectionDetails("SID", m.group(1), m.group(2), m.group(3), effectiveUser);
        }
        // TNS alias or descriptor: keep it as the service so the provenance hash stays stable
        return new ConnectionDetails(UNKNOWN, UNKNOWN, UNKNOWN, target.isEmpty() ? UNKNOWN : target, effectiveUser);
    }

    public static ConnectionDetails unknown(String user) {
        return new ConnectionDetails(UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN, user == null ? UNKNOWN : user);
    }
}
