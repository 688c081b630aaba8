package com.di.repartition.session;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Typed view over a catalog row. Oracle hands back {@link BigDecimal} for every NUMBER column and
 * null for unset statistics; the accessors absorb both.
 */
public final class CatalogRow {

    private final Map<String, Object> values;

    private CatalogRow(Map<String, Object> values) {
        this.values = values;
    }

    public static CatalogRow of(Map<String, Object> values) {
        return new CatalogRow(values);
    }

    public Object raw(String column) {
        Object v = values.get(column);
        if (v == null) {
            v = values.get(column.toUpperCase());
        }
        return v;
    }

    public String getString(String column) {
        Object v = raw(column);
        return v == null ? null : v.toString().trim();
    }

    public Long getLong(String column) {
        Object v = raw(column);
        if (v == null) return null;
        if (v instanceof Number n) return n.longValue();
        return Long.parseLong(v.toString().trim());
    }

    public long getLong(String column, long defaultValue) {
        Long v = getLong(column);
        return v == null ? defaultValue : v;
    }

    public Integer getInteger(String column) {
        Long v = getLong(column);
        return v == null ? null : v.intValue();
    }

    public int getInt(String column, int defaultValue) {
        Integer v = getInteger(column);
        return v == null ? defaultValue : v;
    }

    public Double getDouble(String column) {
        Object v = raw(column);
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        return Double.parseDouble(v.toString().trim());
    }

    public BigDecimal getDecimal(String column) {
        Object v = raw(column);
        if (v == null) return null;
        if (v instanceof BigDecimal d) return d;
        return new BigDecimal(v.toString().trim());
    }

    /** Y / YES / TRUE (any case) are true. */
    public boolean getFlag(String column) {
        Object v = raw(column);
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim();
        return "Y".equalsIgnoreCase(s) || "YES".equalsIgnoreCase(s) || "TRUE".equalsIgnoreCase(s);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
