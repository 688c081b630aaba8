package com.di.repartition.environment;

import com.di.repartition.config.RepartitionProperties;
import com.di.repartition.plan.model.EnvironmentProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnvironmentProfileResolver Tests")
class EnvironmentProfileResolverTest {

    @TempDir
    Path tempDir;

    private static EnvironmentProfileResolver resolver(String profileFile) {
        RepartitionProperties properties = new RepartitionProperties();
        properties.getEnvironment().setProfileFile(profileFile);
        return new EnvironmentProfileResolver(new DefaultResourceLoader(), properties);
    }

    @Test
    @DisplayName("Should resolve global from the bundled profile file")
    void testResolve_Global() {
        EnvironmentProfile profile = resolver("classpath:environments.yml").resolve(null);

        assertEquals("global", profile.getName());
        assertEquals("USERS", profile.primaryTablespace());
        assertEquals(4, profile.lobTablespaces().size());
        assertEquals(2, profile.getSubpartitionDefaults().getMinCount());
        assertEquals(16, profile.getSubpartitionDefaults().getMaxCount());
        assertEquals(5, profile.getSubpartitionDefaults().getSizeBasedRecommendations().size());
        assertEquals(4, profile.getParallelDefaults().getDefaultDegree());
    }

    @Test
    @DisplayName("Should overlay dev on global, keeping untouched keys")
    void testResolve_Dev() {
        EnvironmentProfile profile = resolver("classpath:environments.yml").resolve("dev");

        assertEquals("dev", profile.getName());
        assertEquals("DEV_DATA", profile.primaryTablespace());
        assertEquals(List.of("DEV_LOB_01"), profile.lobTablespaces());
        assertEquals(2, profile.getSubpartitionDefaults().getMinCount());
        assertEquals(8, profile.getSubpartitionDefaults().getMaxCount());
        assertEquals(4, profile.getParallelDefaults().getMaxDegree());
        assertEquals(1, profile.getParallelDefaults().getMinDegree());
        assertEquals(8, profile.subpartitionCountFor(500));
    }

    @Test
    @DisplayName("Should merge a single size tier override into the default tiers")
    void testResolve_ProductionTierOverride() {
        EnvironmentProfile profile = resolver("classpath:environments.yml").resolve("production");

        assertEquals("PROD_DATA", profile.primaryTablespace());
        assertEquals(5, profile.getSubpartitionDefaults().getSizeBasedRecommendations().size());
        assertEquals(32, profile.subpartitionCountFor(500));
        assertEquals(12, profile.subpartitionCountFor(75));
    }

    @Test
    @DisplayName("Should fall back to global for an unknown environment")
    void testResolve_UnknownEnvironment() {
        EnvironmentProfile profile = resolver("classpath:environments.yml").resolve("staging-eu");

        assertEquals("global", profile.getName());
        assertEquals("USERS", profile.primaryTablespace());
    }

    @Test
    @DisplayName("Should use built-in defaults when the profile file is missing")
    void testResolve_MissingFile() {
        EnvironmentProfile profile = resolver("classpath:no-such-environments.yml").resolve("dev");

        assertEquals("global", profile.getName());
        assertEquals("USERS", profile.primaryTablespace());
        assertEquals(8, profile.getParallelDefaults().getMaxDegree());
    }

    @Test
    @DisplayName("Should read a profile file from disk and resolve the configured active environment")
    void testResolveActive_FromFile() throws Exception {
        Path file = tempDir.resolve("envs.yml");
        Files.writeString(file, String.join("\n",
                "environments:",
                "  uat:",
                "    tablespaces:",
                "      data:",
                "        primary: UAT_DATA",
                ""), StandardCharsets.UTF_8);
        RepartitionProperties properties = new RepartitionProperties();
        properties.getEnvironment().setProfileFile("file:" + file.toAbsolutePath());
        properties.getEnvironment().setActive("uat");

        EnvironmentProfile profile = new EnvironmentProfileResolver(new DefaultResourceLoader(), properties).resolveActive();

        assertEquals("uat", profile.getName());
        assertEquals("UAT_DATA", profile.primaryTablespace());
        assertEquals(List.of("GD_LOB_01", "GD_LOB_02", "GD_LOB_03", "GD_LOB_04"), profile.lobTablespaces());
    }

    @Test
    @DisplayName("Should report an unreadable profile file")
    void testResolve_MalformedFile() throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "environments: [unclosed", StandardCharsets.UTF_8);

        assertThrows(EnvironmentConfigException.class, () -> resolver("file:" + file.toAbsolutePath()).resolve("global"));
    }
}
