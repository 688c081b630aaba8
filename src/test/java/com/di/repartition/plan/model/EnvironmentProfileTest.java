package com.di.repartition.plan.model;

import com.di.repartition.support.PlanFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnvironmentProfile Tests")
class EnvironmentProfileTest {

    @ParameterizedTest
    @CsvSource({"0.5, 2", "1, 2", "5, 4", "10, 4", "49.9, 8", "75, 12", "2000, 16", "5000000, 16"})
    @DisplayName("Should pick the first size tier that holds the table")
    void testSubpartitionCountFor(double sizeGb, int expected) {
        assertEquals(expected, PlanFixtures.environment().subpartitionCountFor(sizeGb));
    }

    @Test
    @DisplayName("Should clamp tier counts to the environment bounds and sort tiers by size")
    void testSubpartitionCountFor_ClampedAndUnordered() {
        Map<String, EnvironmentProfile.SizeTier> tiers = new LinkedHashMap<>();
        tiers.put("big", EnvironmentProfile.SizeTier.builder().maxGb(100.0).count(32).build());
        tiers.put("tiny", EnvironmentProfile.SizeTier.builder().maxGb(1.0).count(1).build());
        EnvironmentProfile profile = EnvironmentProfile.builder()
                .name("dev")
                .subpartitionDefaults(EnvironmentProfile.SubpartitionDefaults.builder()
                        .minCount(4).maxCount(8).sizeBasedRecommendations(tiers).build())
                .build();

        assertEquals(4, profile.subpartitionCountFor(0.5));
        assertEquals(8, profile.subpartitionCountFor(50));
        assertEquals(8, profile.subpartitionCountFor(500));
    }

    @Test
    @DisplayName("Should tolerate profiles without tablespace or subpartition sections")
    void testEmptyProfile() {
        EnvironmentProfile empty = EnvironmentProfile.builder().name("bare").build();

        assertNull(empty.primaryTablespace());
        assertEquals(List.of(), empty.lobTablespaces());
        assertEquals(2, empty.subpartitionCountFor(500));
        assertEquals("USERS", PlanFixtures.environment().primaryTablespace());
    }
}
