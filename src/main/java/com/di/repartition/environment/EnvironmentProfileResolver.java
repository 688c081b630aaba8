package com.di.repartition.environment;

import com.di.repartition.config.RepartitionProperties;
import com.di.repartition.plan.model.EnvironmentProfile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;

/**
 * Resolves a named environment profile: built-in defaults, overlaid by {@code environments.global},
 * overlaid by {@code environments.<name>}. Objects merge key by key; scalars and lists are replaced.
 * <p>
 * A missing profile file means built-in defaults only. An unknown environment name resolves to
 * {@code global}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentProfileResolver {

    public static final String GLOBAL = "global";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final RepartitionProperties properties;

    /** Profile for the configured active environment. */
    public EnvironmentProfile resolveActive() {
        return resolve(properties.getEnvironment().getActive());
    }

    public EnvironmentProfile resolve(String environment) {
        String name = environment == null || environment.isBlank() ? GLOBAL : environment.trim();
        JsonNode environments = loadEnvironments();

        ObjectNode merged = builtInDefaults();
        JsonNode global = environments.get(GLOBAL);
        if (global instanceof ObjectNode g) {
            deepMerge(merged, g);
        }
        if (!GLOBAL.equals(name)) {
            JsonNode specific = environments.get(name);
            if (specific instanceof ObjectNode s) {
                deepMerge(merged, s);
            } else {
                log.warn("[ENV] Unknown environment '{}'; using {}", name, GLOBAL);
                name = GLOBAL;
            }
        }
        merged.put("name", name);

        try {
            EnvironmentProfile profile = YAML_MAPPER.treeToValue(merged, EnvironmentProfile.class);
            log.debug("[ENV] Resolved environment '{}': primary tablespace={}, lob tablespaces={}",
                    name, profile.primaryTablespace(), profile.lobTablespaces().size());
            return profile;
        } catch (IOException e) {
            throw new EnvironmentConfigException("Environment profile '" + name + "' cannot be bound: " + e.getMessage(), e);
        }
    }

    private JsonNode loadEnvironments() {
        String location = properties.getEnvironment().getProfileFile();
        if (location == null || location.isBlank()) {
            return JsonNodeFactory.instance.objectNode();
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            log.warn("[ENV] Environment profile file not found: {}; using built-in defaults", location);
            return JsonNodeFactory.instance.objectNode();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = YAML_MAPPER.readTree(in);
            JsonNode environments = root == null ? null : root.get("environments");
            return environments == null || environments.isNull() ? JsonNodeFactory.instance.objectNode() : environments;
        } catch (IOException e) {
            throw new EnvironmentConfigException("Cannot read environment profile file " + location + ": " + e.getMessage(), e);
        }
    }

    /** Recursive overlay: nested objects merge, everything else replaces. */
    static void deepMerge(ObjectNode base, ObjectNode override) {
        Iterator<Map.Entry<String, JsonNode>> fields = override.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = base.get(field.getKey());
            if (existing instanceof ObjectNode e && field.getValue() instanceof ObjectNode o) {
                deepMerge(e, o);
            } else {
                base.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    static ObjectNode builtInDefaults() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        root.put("name", GLOBAL);
        root.put("description", "Built-in defaults");

        ObjectNode data = root.putObject("tablespaces").putObject("data");
        data.put("primary", "USERS");
        ArrayNode lob = data.putArray("lob");
        lob.add("GD_LOB_01").add("GD_LOB_02").add("GD_LOB_03").add("GD_LOB_04");

        ObjectNode sub = root.putObject("subpartition_defaults");
        sub.put("min_count", 2);
        sub.put("max_count", 16);
        ObjectNode tiers = sub.putObject("size_based_recommendations");
        tier(tiers, "small", 1, 2);
        tier(tiers, "medium", 10, 4);
        tier(tiers, "large", 50, 8);
        tier(tiers, "xlarge", 100, 12);
        tier(tiers, "xxlarge", 999_999, 16);

        ObjectNode parallel = root.putObject("parallel_defaults");
        parallel.put("min_degree", 1);
        parallel.put("max_degree", 8);
        parallel.put("default_degree", 4);
        return root;
    }

    private static void tier(ObjectNode tiers, String name, double maxGb, int count) {
        ObjectNode t = tiers.putObject(name);
        t.put("max_gb", maxGb);
        t.put("count", count);
    }
}
