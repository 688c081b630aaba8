package com.di.repartition.discovery;

import com.di.repartition.environment.EnvironmentProfileResolver;
import com.di.repartition.plan.ProvenanceVerifier;
import com.di.repartition.plan.model.AvailableColumns;
import com.di.repartition.plan.model.ColumnInfo;
import com.di.repartition.plan.model.CommonSettings;
import com.di.repartition.plan.model.ConnectionDetails;
import com.di.repartition.plan.model.EnvironmentProfile;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.PlanMetadata;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TableProfile;
import com.di.repartition.recommend.PartitionRecommender;
import com.di.repartition.recommend.Recommendation;
import com.di.repartition.session.CatalogAccessException;
import com.di.repartition.session.QuerySession;
import com.di.repartition.session.QuerySessionFactory;
import com.di.repartition.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds a {@link MigrationPlanDocument} for one schema: schema-wide statistics first, then a
 * profile and a recommendation per table.
 * <p>
 * A table whose detail queries fail is kept with the statistics gathered so far, disabled, and
 * reported as a warning. Losing the session aborts the whole run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaDiscoveryService {

    static final DateTimeFormatter GENERATED_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OracleCatalogReader catalog;
    private final EnvironmentProfileResolver environments;
    private final QuerySessionFactory sessionFactory;

    /** Opens a session from the pool for the duration of the run. */
    public DiscoveryResult discover(DiscoveryRequest request) {
        try (QuerySession session = sessionFactory.open()) {
            return discover(session, request);
        }
    }

    public DiscoveryResult discover(QuerySession session, DiscoveryRequest request) {
        String schema = InputValidator.validateSchemaName(request.getSchema());
        List<String> include = request.getIncludePatterns().stream().map(InputValidator::globToLike).collect(Collectors.toList());
        List<String> exclude = request.getExcludePatterns().stream().map(InputValidator::globToLike).collect(Collectors.toList());
        EnvironmentProfile environment = request.getEnvironment() == null || request.getEnvironment().isBlank()
                ? environments.resolveActive()
                : environments.resolve(request.getEnvironment());
        long start = System.currentTimeMillis();

        log.info("[DISCOVERY] Discovering schema {} (include={}, exclude={}, environment={})",
                schema, include, exclude, environment.getName());

        List<String> tables = catalog.listTables(session, schema, include, exclude);
        SchemaStatistics stats = new SchemaStatistics(
                catalog.partitionStates(session, schema),
                catalog.tableSizes(session, schema),
                catalog.tableStatistics(session, schema),
                catalog.lobCounts(session, schema),
                catalog.indexCounts(session, schema));
        log.info("[DISCOVERY] Found {} table(s) in {}", tables.size(), schema);

        List<TableAnalysis> analyses = new ArrayList<>(tables.size());
        List<String> warnings = new ArrayList<>();
        for (String table : tables) {
            TableAnalysis analysis = analyzeTable(session, schema, table, stats, environment);
            analyses.add(analysis);
            if (analysis.skipped()) {
                warnings.add(String.format("Table %s: analysis failed, recorded with partial data and disabled (%s)",
                        table, analysis.skipReason()));
            }
        }

        List<TableMigrationPlan> plans = analyses.stream().map(TableAnalysis::plan).collect(Collectors.toList());
        MigrationPlanDocument document = MigrationPlanDocument.builder()
                .metadata(buildMetadata(request, schema, environment, tables.size(), plans))
                .environmentConfig(environment)
                .tables(plans)
                .build();

        int enabled = document.enabledTables().size();
        long skipped = analyses.stream().filter(TableAnalysis::skipped).count();
        String summary = String.format("Discovered %d table(s) in %s; %d enabled for migration; %d skipped",
                tables.size(), schema, enabled, skipped);
        log.info("[DISCOVERY] {} in {} ms", summary, System.currentTimeMillis() - start);
        return new DiscoveryResult(document, analyses, warnings, summary);
    }

    // ------------------------------------------------------------------ //
    // Per table                                                           //
    // ------------------------------------------------------------------ //

    private TableAnalysis analyzeTable(QuerySession session, String schema, String table,
                                       SchemaStatistics stats, EnvironmentProfile environment) {
        TableProfile base = null;
        try {
            base = baseProfile(table, stats);
            TableProfile profile = completeProfile(session, schema, table, base, stats.partitions().get(table));
            Recommendation rec = PartitionRecommender.recommend(profile, environment);
            TableMigrationPlan plan = plan(schema, table, profile, rec, rec.enabled());
            log.debug("[DISCOVERY] {}.{}: {} (enabled={})", schema, table, rec.action().getValue(), rec.enabled());
            return TableAnalysis.analyzed(plan);
        } catch (CatalogAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[DISCOVERY] {}.{}: analysis failed, keeping partial data: {}", schema, table, e.getMessage());
            TableProfile partial = base != null ? base : sizeOnlyProfile(table, stats);
            Recommendation rec = PartitionRecommender.recommend(partial, environment);
            return TableAnalysis.skipped(table, e.getMessage(), plan(schema, table, partial, rec, false));
        }
    }

    /** Profile from the schema-wide queries alone; used as-is when the detail queries fail. */
    private static TableProfile baseProfile(String table, SchemaStatistics stats) {
        PartitionState partition = stats.partitions().get(table);
        TableStatistics tableStats = stats.statistics().getOrDefault(table, TableStatistics.EMPTY);
        TableProfile.TableProfileBuilder profile = TableProfile.builder()
                .isPartitioned(partition != null)
                .partitionType(partition == null ? PartitionType.NONE : partition.partitionType())
                .sizeGb(stats.sizes().getOrDefault(table, 0.0))
                .rowCount(tableStats.rowCount())
                .lobCount(stats.lobCounts().getOrDefault(table, 0))
                .indexCount(stats.indexCounts().getOrDefault(table, 0))
                .availableColumns(AvailableColumns.builder().build());
        if (partition != null) {
            profile.isInterval(partition.isInterval())
                    .intervalDefinition(partition.intervalDefinition())
                    .currentPartitionCount(partition.partitionCount())
                    .hasSubpartitions(partition.hasSubpartitions())
                    .subpartitionType(partition.subpartitioningType())
                    .subpartitionCount(partition.defaultSubpartitionCount());
        }
        return profile.build();
    }

    /** Last resort when even the partition state cannot be mapped. */
    private static TableProfile sizeOnlyProfile(String table, SchemaStatistics stats) {
        TableStatistics tableStats = stats.statistics().getOrDefault(table, TableStatistics.EMPTY);
        return TableProfile.builder()
                .isPartitioned(stats.partitions().containsKey(table))
                .partitionType(PartitionType.NONE)
                .sizeGb(stats.sizes().getOrDefault(table, 0.0))
                .rowCount(tableStats.rowCount())
                .lobCount(stats.lobCounts().getOrDefault(table, 0))
                .indexCount(stats.indexCounts().getOrDefault(table, 0))
                .availableColumns(AvailableColumns.builder().build())
                .build();
    }

    private TableProfile completeProfile(QuerySession session, String schema, String table,
                                         TableProfile base, PartitionState partition) {
        TableProfile.TableProfileBuilder profile = base.toBuilder();
        if (partition != null) {
            List<String> keys = catalog.partitionKeys(session, schema, table);
            profile.currentPartitionKey(keys.isEmpty() ? null : String.join(", ", keys));
        }
        List<ColumnInfo> timestamps = catalog.timestampColumns(session, schema, table);
        List<ColumnInfo> numerics = catalog.numericColumns(session, schema, table);
        List<ColumnInfo> strings = catalog.stringColumns(session, schema, table);
        return profile
                .availableColumns(AvailableColumns.builder()
                        .timestampColumns(timestamps)
                        .numericColumns(numerics)
                        .stringColumns(strings)
                        .build())
                .columns(catalog.columns(session, schema, table))
                .lobStorage(catalog.lobStorage(session, schema, table))
                .storageParameters(catalog.storageParameters(session, schema, table))
                .indexes(catalog.indexes(session, schema, table))
                .grants(catalog.grants(session, schema, table))
                .build();
    }

    private static TableMigrationPlan plan(String schema, String table, TableProfile profile,
                                           Recommendation rec, boolean enabled) {
        return TableMigrationPlan.builder()
                .enabled(enabled)
                .owner(schema)
                .tableName(table)
                .currentState(profile)
                .commonSettings(CommonSettings.builder()
                        .newTableName(table + "_NEW")
                        .oldTableName(table + "_OLD")
                        .migrationAction(rec.action())
                        .targetConfiguration(rec.target())
                        .migrationSettings(rec.settings())
                        .build())
                .build();
    }

    // ------------------------------------------------------------------ //
    // Metadata                                                            //
    // ------------------------------------------------------------------ //

    private static PlanMetadata buildMetadata(DiscoveryRequest request, String schema, EnvironmentProfile environment,
                                              int tablesFound, List<TableMigrationPlan> plans) {
        ConnectionDetails connection = request.getJdbcUrl() == null
                ? ConnectionDetails.unknown(request.getUser())
                : ConnectionDetails.fromJdbcUrl(request.getJdbcUrl(), request.getUser());
        String service = connection.getService() == null ? ConnectionDetails.UNKNOWN : connection.getService();
        String generatedDate = LocalDateTime.now().format(GENERATED_DATE_FORMAT);
        int enabled = (int) plans.stream().filter(TableMigrationPlan::isEnabled).count();

        return PlanMetadata.builder()
                .generatedDate(generatedDate)
                .environment(environment.getName())
                .sourceSchema(schema)
                .schema(schema)
                .sourceDatabaseService(service)
                .sourceConnectionDetails(connection)
                .discoveryCriteria(criteria(schema, request))
                .totalTablesFound(tablesFound)
                .tablesSelectedForMigration(enabled)
                .discoveryValidationHash(ProvenanceVerifier.compute(generatedDate, schema, service))
                .build();
    }

    static String criteria(String schema, DiscoveryRequest request) {
        List<String> parts = new ArrayList<>();
        parts.add("Schema: " + schema);
        if (!request.getIncludePatterns().isEmpty()) {
            parts.add("Include: " + String.join(", ", request.getIncludePatterns()));
        }
        if (!request.getExcludePatterns().isEmpty()) {
            parts.add("Exclude: " + String.join(", ", request.getExcludePatterns()));
        }
        return String.join(", ", parts);
    }

    private record SchemaStatistics(
            Map<String, PartitionState> partitions,
            Map<String, Double> sizes,
            Map<String, TableStatistics> statistics,
            Map<String, Integer> lobCounts,
            Map<String, Integer> indexCounts
    ) {}
}
