package com.di.repartition.validation;

import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.PartitionType;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TargetConfiguration;
import com.di.repartition.support.FakeQuerySession;
import com.di.repartition.support.PlanFixtures;
import com.di.repartition.support.SqlQueriesFixture;
import com.di.repartition.sql.SqlQueriesProperties;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.DataRetrievalFailureException;

import static com.di.repartition.support.FakeQuerySession.row;
import static com.di.repartition.support.FakeQuerySession.rows;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigValidator Tests")
class ConfigValidatorTest {

    private static ValidatorFactory validatorFactory;
    private static ConfigValidator validator;
    private static SqlQueriesProperties sql;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        Validator beanValidator = validatorFactory.getValidator();
        sql = SqlQueriesFixture.load();
        validator = new ConfigValidator(beanValidator, sql);
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    private static TableMigrationPlan withTarget(TableMigrationPlan plan, TargetConfiguration.TargetConfigurationBuilder target) {
        return PlanFixtures.withTarget(plan, target.build());
    }

    // ============================================================================
    // Clean documents
    // ============================================================================

    @Test
    @DisplayName("Should accept a consistent document without warnings")
    void testValidate_CleanDocument() {
        ValidationOutcome outcome = validator.validate(PlanFixtures.document(PlanFixtures.table("ORDERS")), false);

        assertTrue(outcome.valid(), () -> "errors: " + outcome.errors());
        assertTrue(outcome.errors().isEmpty());
        assertTrue(outcome.warnings().isEmpty(), () -> "warnings: " + outcome.warnings());
        assertTrue(outcome.discoveryGenerated());
    }

    @Test
    @DisplayName("Should return identical outcomes for repeated calls")
    void testValidate_Idempotent() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().subpartitionCount(6)));

        ValidationOutcome first = validator.validate(document, false);
        ValidationOutcome second = validator.validate(document, false);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should report provenance without affecting validity")
    void testValidate_NotDiscoveryGenerated() {
        MigrationPlanDocument document = PlanFixtures.document(PlanFixtures.table("ORDERS"));
        MigrationPlanDocument edited = document.toBuilder()
                .metadata(document.getMetadata().toBuilder().sourceSchema("OTHER").schema("OTHER").build())
                .build();

        ValidationOutcome outcome = validator.validate(edited, false);

        assertTrue(outcome.valid());
        assertFalse(outcome.discoveryGenerated());
    }

    // ============================================================================
    // Structural tier
    // ============================================================================

    @Test
    @DisplayName("Should report missing required fields with their JSON path")
    void testValidate_StructuralMissingField() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().partitionType(null)));

        ValidationOutcome outcome = validator.validate(document, false);

        assertFalse(outcome.valid());
        assertTrue(outcome.errors().stream().anyMatch(e ->
                e.startsWith("Structural: tables[0].common_settings.target_configuration.partition_type")));
    }

    @Test
    @DisplayName("Should reject duplicate table names")
    void testValidate_DuplicateTableName() {
        MigrationPlanDocument document = PlanFixtures.document(PlanFixtures.table("ORDERS"), PlanFixtures.table("ORDERS"));

        ValidationOutcome outcome = validator.validate(document, false);

        assertFalse(outcome.valid());
        assertTrue(outcome.errors().contains("Duplicate table name: ORDERS"));
    }

    @Test
    @DisplayName("Should reject a null document")
    void testValidate_NullDocument() {
        ValidationOutcome outcome = validator.validate(null, false);
        assertFalse(outcome.valid());
        assertEquals(1, outcome.errors().size());
    }

    @Test
    @DisplayName("Should convert property paths to snake_case")
    void testJsonPath() {
        assertEquals("tables[2].current_state.available_columns",
                ConfigValidator.jsonPath("tables[2].currentState.availableColumns"));
        assertEquals("metadata.source_schema", ConfigValidator.jsonPath("metadata.sourceSchema"));
    }

    // ============================================================================
    // Logical tier
    // ============================================================================

    @Test
    @DisplayName("Should reject subpartition counts above 1024")
    void testValidate_SubpartitionCountTooHigh() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().subpartitionCount(2000)));

        ValidationOutcome outcome = validator.validate(document, false);

        assertFalse(outcome.valid());
        assertTrue(outcome.errors().contains("Table ORDERS: subpartition_count 2000 exceeds maximum (1024)"));
    }

    @Test
    @DisplayName("Should warn exactly once for a subpartition count that is not a power of two")
    void testValidate_SubpartitionCountNotPowerOfTwo() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().subpartitionCount(6)));

        ValidationOutcome outcome = validator.validate(document, false);

        assertTrue(outcome.valid());
        assertEquals(1, outcome.warnings().size(), () -> "warnings: " + outcome.warnings());
        assertEquals("Table ORDERS: subpartition_count 6 is not a power of 2 (recommended: 2, 4, 8, 16, 32, ...)",
                outcome.warnings().get(0));
    }

    @Test
    @DisplayName("Should reject a partition column that is not a timestamp candidate")
    void testValidate_PartitionColumnNotTimestamp() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().partitionColumn("ORDER_ID")));

        ValidationOutcome outcome = validator.validate(document, false);

        assertTrue(outcome.errors().contains("Table ORDERS: partition_column 'ORDER_ID' not in available timestamp columns"));
    }

    @Test
    @DisplayName("Should require a partition column for INTERVAL partitioning")
    void testValidate_IntervalWithoutPartitionColumn() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().partitionColumn(null)));

        ValidationOutcome outcome = validator.validate(document, false);

        assertTrue(outcome.errors().contains("Table ORDERS: partition_column required for INTERVAL partitioning"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-01", "TO_DATE(2024-01-01)", "SYSDATE"})
    @DisplayName("Should reject initial partition values that are not TO_DATE literals")
    void testValidate_InvalidInitialPartitionValue(String value) {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(
                withTarget(plan, plan.target().toBuilder().initialPartitionValue(value)));

        ValidationOutcome outcome = validator.validate(document, false);

        assertTrue(outcome.errors().contains("Table ORDERS: initial_partition_value must be Oracle TO_DATE format, got: " + value));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "TO_DATE('2024-01-01', 'YYYY-MM-DD')",
            "to_date('2024/01/01 00:00:00', 'YYYY/MM/DD HH24:MI:SS')",
            "TO_TIMESTAMP('2024-01-01 00:00:00.000', 'YYYY-MM-DD HH24:MI:SS.FF3')"
    })
    @DisplayName("Should accept TO_DATE and TO_TIMESTAMP literals")
    void testIsValidInitialPartitionValue(String value) {
        assertTrue(LogicalRules.isValidInitialPartitionValue(value));
    }

    @Test
    @DisplayName("Should warn when metadata counts drift from the tables")
    void testValidate_MetadataCountDrift() {
        MigrationPlanDocument document = PlanFixtures.document(PlanFixtures.table("ORDERS"));
        MigrationPlanDocument pruned = document.toBuilder()
                .metadata(document.getMetadata().toBuilder().totalTablesFound(3).build())
                .build();

        ValidationOutcome outcome = validator.validate(pruned, false);

        assertTrue(outcome.valid());
        assertEquals("Metadata says 3 tables found, but config has 1 tables", outcome.warnings().get(0));
    }

    @Test
    @DisplayName("Should warn when values fall outside the environment bounds")
    void testValidate_EnvironmentBounds() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(withTarget(plan, plan.target().toBuilder()
                .subpartitionCount(32)
                .parallelDegree(12)
                .tablespace("DATA_TS")));

        ValidationOutcome outcome = validator.validate(document, false);

        assertTrue(outcome.warnings().contains("Table ORDERS: subpartition_count 32 above environment maximum 16"));
        assertTrue(outcome.warnings().contains("Table ORDERS: parallel_degree 12 above environment maximum 8"));
        assertTrue(outcome.warnings().contains("Table ORDERS: tablespace DATA_TS differs from environment default USERS"));
    }

    @Test
    @DisplayName("Should not require a partition column for non-interval targets")
    void testValidate_RangeWithoutPartitionColumn() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        MigrationPlanDocument document = PlanFixtures.document(withTarget(plan, plan.target().toBuilder()
                .partitionType(PartitionType.HASH)
                .partitionColumn(null)));

        ValidationOutcome outcome = validator.validate(document, false);

        assertTrue(outcome.valid(), () -> "errors: " + outcome.errors());
    }

    // ============================================================================
    // Best-practice tier
    // ============================================================================

    @Test
    @DisplayName("Should warn about a large table with low parallelism and no backup")
    void testValidate_BestPractices() {
        TableMigrationPlan plan = PlanFixtures.table("ORDERS");
        TableMigrationPlan large = plan.toBuilder()
                .currentState(plan.getCurrentState().toBuilder().sizeGb(120.0).build())
                .commonSettings(plan.getCommonSettings().toBuilder()
                        .migrationSettings(plan.settings().toBuilder().backupOldTable(false).build())
                        .build())
                .build();

        ValidationOutcome outcome = validator.validate(PlanFixtures.document(large), false);

        assertTrue(outcome.valid());
        assertTrue(outcome.warnings().contains("Table ORDERS: Large table (120.0 GB) with low parallel degree (2)"));
        assertTrue(outcome.warnings().contains("Table ORDERS: Very large table (120.0 GB) may benefit from more subpartitions (current: 4, consider: 16)"));
        assertTrue(outcome.warnings().contains("Table ORDERS: Old table backup disabled - no rollback possible"));
    }

    // ============================================================================
    // Live database tier
    // ============================================================================

    @Test
    @DisplayName("Should warn when database validation is requested without a session")
    void testValidate_DatabaseCheckWithoutSession() {
        ValidationOutcome outcome = validator.validate(PlanFixtures.document(PlanFixtures.table("ORDERS")), true);

        assertTrue(outcome.valid());
        assertEquals(1, outcome.warnings().size());
        assertEquals("Database validation requested but no connection provided", outcome.warnings().get(0));
    }

    @Test
    @DisplayName("Should check tables and columns against the live dictionary")
    void testValidate_LiveChecks() {
        SqlQueriesProperties.Validation q = sql.getValidation();
        FakeQuerySession session = new FakeQuerySession()
                .on(q.getTableExists(), "tableName", "ORDERS", rows(row("table_count", 1)))
                .on(q.getTableExists(), "tableName", "MISSING", rows(row("table_count", 0)))
                .on(q.getColumnDefinition(), "columnName", "CREATED_DATE",
                        rows(row("data_type", "VARCHAR2", "nullable", "N")))
                .on(q.getColumnDefinition(), "columnName", "ORDER_ID",
                        rows(row("data_type", "NUMBER", "nullable", "Y")));

        MigrationPlanDocument document = PlanFixtures.document(PlanFixtures.table("ORDERS"), PlanFixtures.table("MISSING"));
        ValidationOutcome outcome = validator.validate(document, true, session);

        assertFalse(outcome.valid());
        assertTrue(outcome.errors().contains("Table APP.MISSING: table does not exist"));
        assertTrue(outcome.warnings().contains(
                "Table APP.ORDERS: partition column 'CREATED_DATE' type 'VARCHAR2' may not be suitable for interval partitioning"));
        assertTrue(outcome.warnings().stream().anyMatch(w ->
                w.startsWith("Table APP.ORDERS: subpartition column 'ORDER_ID'") && w.contains("allows NULL")));
    }

    @Test
    @DisplayName("Should record query failures as errors and keep validating")
    void testValidate_LiveQueryFailure() {
        SqlQueriesProperties.Validation q = sql.getValidation();
        FakeQuerySession session = new FakeQuerySession()
                .failing(q.getTableExists(), new DataRetrievalFailureException("ORA-00942: table or view does not exist"));

        ValidationOutcome outcome = validator.validate(PlanFixtures.document(PlanFixtures.table("ORDERS")), true, session);

        assertFalse(outcome.valid());
        assertTrue(outcome.errors().get(0).startsWith("Table APP.ORDERS: error checking existence:"));
    }
}
