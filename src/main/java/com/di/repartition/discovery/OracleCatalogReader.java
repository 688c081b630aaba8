package com.di.repartition.discovery;

import com.di.repartition.plan.model.ColumnInfo;
import com.di.repartition.plan.model.GrantInfo;
import com.di.repartition.plan.model.IndexInfo;
import com.di.repartition.plan.model.LobStorageInfo;
import com.di.repartition.plan.model.StorageParameters;
import com.di.repartition.session.CatalogRow;
import com.di.repartition.session.QuerySession;
import com.di.repartition.sql.SqlQueriesProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only Oracle dictionary queries behind schema discovery. Schema-wide methods return maps keyed
 * by table name; per-table methods return model objects. Every value is bound; owner and table name
 * are never spliced into SQL here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OracleCatalogReader {

    /** {@code LOB_TS_01} → {@code LOB_TS}. */
    private static final Pattern TWO_DIGIT_SUFFIX = Pattern.compile("^(.+)_(\\d{2})$");

    private final SqlQueriesProperties sql;

    // ------------------------------------------------------------------ //
    // Schema-wide                                                         //
    // ------------------------------------------------------------------ //

    /**
     * Tables of {@code owner} matching any include pattern and none of the exclude patterns.
     * Patterns are LIKE patterns (already converted from globs).
     */
    public List<String> listTables(QuerySession session, String owner, List<String> includeLike, List<String> excludeLike) {
        SqlQueriesProperties.Discovery q = sql.getDiscovery();
        StringBuilder query = new StringBuilder(q.getTablesBase());
        Map<String, Object> params = new HashMap<>();
        params.put("owner", owner);
        if (includeLike != null && !includeLike.isEmpty()) {
            List<String> clauses = new ArrayList<>();
            for (int i = 0; i < includeLike.size(); i++) {
                String name = "inc" + i;
                clauses.add(String.format(q.getTablesIncludeFilter(), name));
                params.put(name, includeLike.get(i));
            }
            query.append(" AND (").append(String.join(" OR ", clauses)).append(")");
        }
        if (excludeLike != null) {
            for (int i = 0; i < excludeLike.size(); i++) {
                String name = "exc" + i;
                query.append(" AND ").append(String.format(q.getTablesExcludeFilter(), name));
                params.put(name, excludeLike.get(i));
            }
        }
        query.append(' ').append(q.getTablesOrder());
        return session.query(query.toString(), params).stream()
                .map(r -> CatalogRow.of(r).getString("table_name"))
                .collect(Collectors.toList());
    }

    public Map<String, PartitionState> partitionStates(QuerySession session, String owner) {
        Map<String, PartitionState> states = new HashMap<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getPartitionState(), Map.of("owner", owner))) {
            CatalogRow row = CatalogRow.of(r);
            String subType = row.getString("subpartitioning_type");
            if ("NONE".equalsIgnoreCase(subType)) {
                subType = null;
            }
            states.put(row.getString("table_name"), new PartitionState(
                    row.getString("partitioning_type"),
                    subType,
                    row.getString("interval"),
                    row.getInteger("partition_count"),
                    row.getInteger("def_subpartition_count")));
        }
        return states;
    }

    /** Estimated GB per non-empty table, floored at 0.01. */
    public Map<String, Double> tableSizes(QuerySession session, String owner) {
        Map<String, Double> sizes = new HashMap<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getTableSizes(), Map.of("owner", owner))) {
            CatalogRow row = CatalogRow.of(r);
            Double gb = row.getDouble("estimated_gb");
            sizes.put(row.getString("table_name"), gb != null && gb > 0 ? gb : 0.01);
        }
        return sizes;
    }

    public Map<String, TableStatistics> tableStatistics(QuerySession session, String owner) {
        Map<String, TableStatistics> stats = new HashMap<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getTableStats(), Map.of("owner", owner))) {
            CatalogRow row = CatalogRow.of(r);
            stats.put(row.getString("table_name"), new TableStatistics(
                    row.getLong("num_rows", 0),
                    row.getLong("avg_row_len", 0),
                    row.getLong("blocks", 0),
                    row.getString("tablespace_name")));
        }
        return stats;
    }

    public Map<String, Integer> lobCounts(QuerySession session, String owner) {
        return counts(session, sql.getDiscovery().getLobCounts(), owner, "lob_count");
    }

    public Map<String, Integer> indexCounts(QuerySession session, String owner) {
        return counts(session, sql.getDiscovery().getIndexCounts(), owner, "index_count");
    }

    private static Map<String, Integer> counts(QuerySession session, String query, String owner, String column) {
        Map<String, Integer> counts = new HashMap<>();
        for (Map<String, Object> r : session.query(query, Map.of("owner", owner))) {
            CatalogRow row = CatalogRow.of(r);
            counts.put(row.getString("table_name"), row.getInt(column, 0));
        }
        return counts;
    }

    // ------------------------------------------------------------------ //
    // Per table                                                           //
    // ------------------------------------------------------------------ //

    public List<String> partitionKeys(QuerySession session, String owner, String table) {
        return session.query(sql.getDiscovery().getPartitionKeys(), tableParams(owner, table)).stream()
                .map(r -> CatalogRow.of(r).getString("column_name"))
                .collect(Collectors.toList());
    }

    /** DATE and TIMESTAMP columns, preferred audit-date names first. */
    public List<ColumnInfo> timestampColumns(QuerySession session, String owner, String table) {
        return candidateColumns(session, sql.getDiscovery().getTimestampColumns(), owner, table);
    }

    /** Numeric columns, id-like names first. */
    public List<ColumnInfo> numericColumns(QuerySession session, String owner, String table) {
        return candidateColumns(session, sql.getDiscovery().getNumericColumns(), owner, table);
    }

    /** Up to ten short character columns, code/key names first. */
    public List<ColumnInfo> stringColumns(QuerySession session, String owner, String table) {
        return candidateColumns(session, sql.getDiscovery().getStringColumns(), owner, table);
    }

    private static List<ColumnInfo> candidateColumns(QuerySession session, String query, String owner, String table) {
        return session.query(query, tableParams(owner, table)).stream()
                .map(CatalogRow::of)
                .map(row -> ColumnInfo.builder()
                        .name(row.getString("column_name"))
                        .type(row.getString("data_type"))
                        .nullable(row.getString("nullable"))
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Full column list in column order, virtual columns skipped, identity details merged in.
     */
    public List<ColumnInfo> columns(QuerySession session, String owner, String table) {
        Map<String, CatalogRow> identity = new LinkedHashMap<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getIdentityColumns(), tableParams(owner, table))) {
            CatalogRow row = CatalogRow.of(r);
            identity.put(row.getString("column_name"), row);
        }

        List<ColumnInfo> columns = new ArrayList<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getColumns(), tableParams(owner, table))) {
            CatalogRow row = CatalogRow.of(r);
            if (row.getFlag("virtual_column")) {
                continue;
            }
            String name = row.getString("column_name");
            ColumnInfo.ColumnInfoBuilder column = ColumnInfo.builder()
                    .name(name)
                    .type(row.getString("data_type"))
                    .length(row.getInteger("data_length"))
                    .precision(row.getInteger("data_precision"))
                    .scale(row.getInteger("data_scale"))
                    .nullable(row.getString("nullable"))
                    .defaultValue(row.getString("data_default"))
                    .charLength(row.getInteger("char_length"))
                    .isIdentity(identity.containsKey(name));
            CatalogRow id = identity.get(name);
            if (id != null) {
                column.identityGeneration(id.getString("generation_type"))
                        .identitySequence(id.getString("sequence_name"))
                        .identityStartWith(id.getLong("start_value", 1))
                        .identityIncrementBy(id.getLong("increment_by", 1))
                        .identityMaxValue(id.getDecimal("max_value"))
                        .identityMinValue(id.getDecimal("min_value"))
                        .identityCacheSize(id.getLong("cache_size"))
                        .identityCycleFlag(valueOr(id.getString("cycle_flag"), "N"))
                        .identityOrderFlag(valueOr(id.getString("order_flag"), "N"));
            }
            columns.add(column.build());
        }
        return columns;
    }

    public List<LobStorageInfo> lobStorage(QuerySession session, String owner, String table) {
        return session.query(sql.getDiscovery().getLobStorage(), tableParams(owner, table)).stream()
                .map(CatalogRow::of)
                .map(row -> {
                    String tablespace = row.getString("tablespace_name");
                    return LobStorageInfo.builder()
                            .columnName(row.getString("column_name"))
                            .segmentName(row.getString("segment_name"))
                            .tablespaceName(baseTablespace(tablespace))
                            .originalTablespace(tablespace)
                            .securefile(row.getString("securefile"))
                            .compression(row.getString("compression"))
                            .deduplication(row.getString("deduplication"))
                            .inRow(row.getString("in_row"))
                            .chunk(row.getLong("chunk"))
                            .cache(row.getString("cache"))
                            .build();
                })
                .collect(Collectors.toList());
    }

    /** Storage clause of the table, or null when the table row is not visible. */
    public StorageParameters storageParameters(QuerySession session, String owner, String table) {
        List<Map<String, Object>> rows = session.query(sql.getDiscovery().getStorageParameters(), tableParams(owner, table));
        if (rows.isEmpty()) {
            return null;
        }
        CatalogRow row = CatalogRow.of(rows.get(0));
        return StorageParameters.builder()
                .compression(row.getString("compression"))
                .compressFor(row.getString("compress_for"))
                .pctFree(row.getInteger("pct_free"))
                .iniTrans(row.getInteger("ini_trans"))
                .maxTrans(row.getInteger("max_trans"))
                .initialExtent(row.getLong("initial_extent"))
                .nextExtent(row.getLong("next_extent"))
                .bufferPool(row.getString("buffer_pool"))
                .build();
    }

    /**
     * Index definitions with their key columns. Locality is looked up for partitioned indexes only;
     * a failed lookup leaves it unset.
     */
    public List<IndexInfo> indexes(QuerySession session, String owner, String table) {
        Map<String, String> indexColumns = new HashMap<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getIndexColumns(), tableParams(owner, table))) {
            CatalogRow row = CatalogRow.of(r);
            indexColumns.put(row.getString("index_name"), row.getString("index_columns"));
        }

        List<IndexInfo> indexes = new ArrayList<>();
        for (Map<String, Object> r : session.query(sql.getDiscovery().getIndexes(), tableParams(owner, table))) {
            CatalogRow row = CatalogRow.of(r);
            String indexName = row.getString("index_name");
            String indexType = row.getString("index_type");
            String partitioned = row.getString("partitioned");
            indexes.add(IndexInfo.builder()
                    .indexName(indexName)
                    .indexType(indexType)
                    .uniqueness(row.getString("uniqueness"))
                    .tablespaceName(row.getString("tablespace_name"))
                    .compression(row.getString("compression"))
                    .pctFree(row.getInteger("pct_free"))
                    .iniTrans(row.getInteger("ini_trans"))
                    .maxTrans(row.getInteger("max_trans"))
                    .degree(row.getString("degree"))
                    .partitioned(partitioned)
                    .columns(valueOr(indexColumns.get(indexName), ""))
                    .isReverse(indexType != null && indexType.contains("REVERSE"))
                    .locality("YES".equalsIgnoreCase(partitioned) ? indexLocality(session, owner, indexName) : null)
                    .build());
        }
        return indexes;
    }

    private String indexLocality(QuerySession session, String owner, String indexName) {
        try {
            List<Map<String, Object>> rows = session.query(sql.getDiscovery().getIndexLocality(),
                    Map.of("owner", owner, "indexName", indexName));
            return rows.isEmpty() ? null : CatalogRow.of(rows.get(0)).getString("locality");
        } catch (DataAccessException e) {
            log.warn("[DISCOVERY] Could not fetch locality for index {}.{}: {}", owner, indexName, e.getMessage());
            return null;
        }
    }

    /** Object grants, excluding SYS, SYSTEM and PUBLIC. */
    public List<GrantInfo> grants(QuerySession session, String owner, String table) {
        return session.query(sql.getDiscovery().getGrants(), tableParams(owner, table)).stream()
                .map(CatalogRow::of)
                .map(row -> GrantInfo.builder()
                        .grantee(row.getString("grantee"))
                        .privilege(row.getString("privilege"))
                        .grantable(row.getString("grantable"))
                        .grantor(row.getString("grantor"))
                        .build())
                .collect(Collectors.toList());
    }

    // ------------------------------------------------------------------ //

    static String baseTablespace(String tablespace) {
        if (tablespace == null) return null;
        Matcher m = TWO_DIGIT_SUFFIX.matcher(tablespace);
        return m.matches() ? m.group(1) : tablespace;
    }

    private static Map<String, Object> tableParams(String owner, String table) {
        return Map.of("owner", owner, "tableName", table);
    }

    private static String valueOr(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
