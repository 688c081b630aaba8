package com.di.repartition.plan;

import com.di.repartition.plan.model.EnvironmentProfile;
import com.di.repartition.plan.model.MigrationAction;
import com.di.repartition.plan.model.MigrationPlanDocument;
import com.di.repartition.plan.model.MigrationSettings;
import com.di.repartition.plan.model.TableMigrationPlan;
import com.di.repartition.plan.model.TableProfile;
import com.di.repartition.plan.model.TargetConfiguration;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Flattened per-table context handed to a {@link ScriptRenderer}. Tablespaces left empty in the
 * plan are filled from the environment profile here, so templates never need to fall back themselves.
 */
@Value
@Builder
public class ScriptRenderContext {

    String owner;
    String tableName;
    String newTableName;
    String oldTableName;
    MigrationAction migrationAction;
    TableProfile currentState;
    TargetConfiguration target;
    MigrationSettings settings;
    EnvironmentProfile environment;
    String dataTablespace;
    List<String> lobTablespaces;
    String sourceSchema;
    String generatedDate;
    String discoveryValidationHash;

    public static ScriptRenderContext of(MigrationPlanDocument document, TableMigrationPlan plan) {
        EnvironmentProfile env = document.getEnvironmentConfig();
        TargetConfiguration target = plan.target();
        String dataTablespace = target != null && target.getTablespace() != null && !target.getTablespace().isBlank()
                ? target.getTablespace()
                : (env != null ? env.primaryTablespace() : null);
        List<String> lobTablespaces = target != null && target.getLobTablespaces() != null && !target.getLobTablespaces().isEmpty()
                ? target.getLobTablespaces()
                : (env != null ? env.lobTablespaces() : List.of());
        String oldTableName = plan.getCommonSettings() != null && plan.getCommonSettings().getOldTableName() != null
                ? plan.getCommonSettings().getOldTableName()
                : plan.getTableName() + "_OLD";
        return ScriptRenderContext.builder()
                .owner(plan.getOwner())
                .tableName(plan.getTableName())
                .newTableName(plan.newTableName())
                .oldTableName(oldTableName)
                .migrationAction(plan.action())
                .currentState(plan.getCurrentState())
                .target(target)
                .settings(plan.settings())
                .environment(env)
                .dataTablespace(dataTablespace)
                .lobTablespaces(lobTablespaces)
                .sourceSchema(document.getMetadata() != null ? document.getMetadata().effectiveSchema() : plan.getOwner())
                .generatedDate(document.getMetadata() != null ? document.getMetadata().getGeneratedDate() : null)
                .discoveryValidationHash(document.getMetadata() != null ? document.getMetadata().getDiscoveryValidationHash() : null)
                .build();
    }
}
