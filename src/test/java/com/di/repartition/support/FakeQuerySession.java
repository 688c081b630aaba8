package com.di.repartition.support;

import com.di.repartition.session.QuerySession;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Scripted in-memory {@link QuerySession}. Routes are tried in registration order; the first whose
 * predicate accepts the SQL answers. Unrouted queries return no rows.
 */
public class FakeQuerySession implements QuerySession {

    private final List<Route> routes = new ArrayList<>();
    private final List<Call> calls = new ArrayList<>();
    private boolean closed;

    public record Call(String sql, Map<String, ?> params) {}

    private record Route(Predicate<String> sql, Predicate<Map<String, ?>> params,
                         Function<Map<String, ?>, List<Map<String, Object>>> answer) {}

    /** Answers {@code sql} (exact match) with fixed rows. */
    public FakeQuerySession on(String sql, List<Map<String, Object>> rows) {
        return when(sql::equals, p -> true, p -> rows);
    }

    /** Answers {@code sql} with fixed rows when the named parameter has the given value. */
    public FakeQuerySession on(String sql, String param, Object value, List<Map<String, Object>> rows) {
        return when(sql::equals, p -> value.equals(p.get(param)), p -> rows);
    }

    public FakeQuerySession onContaining(String fragment, List<Map<String, Object>> rows) {
        return when(s -> s.contains(fragment), p -> true, p -> rows);
    }

    public FakeQuerySession onContaining(String fragment, Function<Map<String, ?>, List<Map<String, Object>>> answer) {
        return when(s -> s.contains(fragment), p -> true, answer);
    }

    public FakeQuerySession failing(String sql, RuntimeException error) {
        return when(sql::equals, p -> true, p -> { throw error; });
    }

    public FakeQuerySession failing(String sql, String param, Object value, RuntimeException error) {
        return when(sql::equals, p -> value.equals(p.get(param)), p -> { throw error; });
    }

    public FakeQuerySession failingContaining(String fragment, RuntimeException error) {
        return when(s -> s.contains(fragment), p -> true, p -> { throw error; });
    }

    public FakeQuerySession when(Predicate<String> sql, Predicate<Map<String, ?>> params,
                                 Function<Map<String, ?>, List<Map<String, Object>>> answer) {
        routes.add(new Route(sql, params, answer));
        return this;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Map<String, ?> params) {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
        Map<String, ?> safeParams = params == null ? Map.of() : params;
        calls.add(new Call(sql, safeParams));
        for (Route route : routes) {
            if (route.sql().test(sql) && route.params().test(safeParams)) {
                return route.answer().apply(safeParams);
            }
        }
        return List.of();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<Call> getCalls() {
        return calls;
    }

    public long countCalls(Predicate<String> sql) {
        return calls.stream().filter(c -> sql.test(c.sql())).count();
    }

    /** One case-insensitive row from alternating column/value pairs; values may be null. */
    public static Map<String, Object> row(Object... columnValues) {
        Map<String, Object> row = new LinkedCaseInsensitiveMap<>();
        for (int i = 0; i + 1 < columnValues.length; i += 2) {
            row.put((String) columnValues[i], columnValues[i + 1]);
        }
        return row;
    }

    @SafeVarargs
    public static List<Map<String, Object>> rows(Map<String, Object>... rows) {
        return new ArrayList<>(List.of(rows));
    }

    public static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
