package com.di.repartition.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every API call with MDC keys so discovery and migration-check log lines of concurrent
 * callers can be told apart:
 * <ul>
 *   <li>{@code requestId}: the caller's {@code X-Request-Id} when it is a plain token, else generated; echoed back</li>
 *   <li>{@code requestPath}: request URI</li>
 *   <li>{@code schema}: the {@code schema} query parameter of discovery calls, upper-cased</li>
 * </ul>
 * Completion is logged at debug with status and elapsed time.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID = "requestId";
    public static final String REQUEST_PATH = "requestPath";
    public static final String SCHEMA = "schema";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    /** Caller ids end up in log lines; anything else is replaced. */
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,64}$");
    private static final Pattern SAFE_SCHEMA = Pattern.compile("^[A-Za-z][A-Za-z0-9_$#]{0,127}$");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestIdOf(request);
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, request.getRequestURI() != null ? request.getRequestURI() : "");
        String schema = request.getParameter(SCHEMA);
        if (schema != null && SAFE_SCHEMA.matcher(schema.trim()).matches()) {
            MDC.put(SCHEMA, schema.trim().toUpperCase(Locale.ROOT));
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);

        long start = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("[API] {} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), System.currentTimeMillis() - start);
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
            MDC.remove(SCHEMA);
        }
    }

    static String requestIdOf(HttpServletRequest request) {
        String supplied = request.getHeader(REQUEST_ID_HEADER);
        if (supplied != null && SAFE_REQUEST_ID.matcher(supplied.trim()).matches()) {
            return supplied.trim();
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
