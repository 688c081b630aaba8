package com.di.repartition.recommend;

import com.di.repartition.plan.model.MigrationAction;
import com.di.repartition.plan.model.MigrationSettings;
import com.di.repartition.plan.model.TargetConfiguration;

/**
 * Output of {@link PartitionRecommender#recommend}: the target layout, the migration settings,
 * the action implied by the current layout and whether the table should be enabled by default.
 */
public record Recommendation(
        TargetConfiguration target,
        MigrationSettings settings,
        MigrationAction action,
        boolean enabled
) {}
