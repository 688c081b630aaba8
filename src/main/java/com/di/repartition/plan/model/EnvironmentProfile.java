package com.di.repartition.plan.model;

import jakarta.validation.Valid;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named environment defaults (tablespaces, subpartition and parallel bounds). Embedded in the plan
 * document as {@code environment_config}; resolved by {@code EnvironmentProfileResolver}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EnvironmentProfile {

    String name;
    String description;

    @Valid
    Tablespaces tablespaces;

    @Valid
    SubpartitionDefaults subpartitionDefaults;

    @Valid
    ParallelDefaults parallelDefaults;

    public String primaryTablespace() {
        return tablespaces == null || tablespaces.getData() == null ? null : tablespaces.getData().getPrimary();
    }

    public List<String> lobTablespaces() {
        if (tablespaces == null || tablespaces.getData() == null || tablespaces.getData().getLob() == null) {
            return List.of();
        }
        return tablespaces.getData().getLob();
    }

    /**
     * Size-tier lookup: first tier (by ascending {@code max_gb}) that holds {@code sizeGb}, clamped to
     * {@code [min_count, max_count]}. Falls back to {@code max_count} when no tier matches.
     */
    public int subpartitionCountFor(double sizeGb) {
        SubpartitionDefaults d = subpartitionDefaults;
        if (d == null) {
            return 2;
        }
        int min = d.getMinCount() != null ? d.getMinCount() : 2;
        int max = d.getMaxCount() != null ? d.getMaxCount() : 16;
        if (d.getSizeBasedRecommendations() != null) {
            SizeTier tier = d.getSizeBasedRecommendations().values().stream()
                    .filter(t -> t.getMaxGb() != null && t.getCount() != null)
                    .sorted(Comparator.comparingDouble(SizeTier::getMaxGb))
                    .filter(t -> sizeGb <= t.getMaxGb())
                    .findFirst()
                    .orElse(null);
            if (tier != null) {
                return Math.min(Math.max(tier.getCount(), min), max);
            }
        }
        return max;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class Tablespaces {
        @Valid
        DataTablespaces data;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class DataTablespaces {
        String primary;
        @Builder.Default
        List<String> lob = List.of();
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class SubpartitionDefaults {
        Integer minCount;
        Integer maxCount;
        /** Keyed by tier name (small, medium, ...), in file order. */
        @Builder.Default
        Map<String, SizeTier> sizeBasedRecommendations = new LinkedHashMap<>();
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class SizeTier {
        Double maxGb;
        Integer count;
    }

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class ParallelDefaults {
        Integer minDegree;
        Integer maxDegree;
        Integer defaultDegree;
    }
}
