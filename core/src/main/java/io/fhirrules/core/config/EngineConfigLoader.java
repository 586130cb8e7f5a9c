package io.fhirrules.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fhirrules.core.error.ConfigLoadException;
import io.fhirrules.core.model.FindingSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Every key can be overridden by an environment variable, and environment
 * values take precedence over YAML values. A variable counts as "set" only if
 * it is defined and its trimmed value is non-empty.
 *
 * <table>
 * <caption>Keys</caption>
 * <tr><th>YAML key</th><th>Environment variable</th></tr>
 * <tr><td>{@code reference-policy}</td><td>{@code FHIR_RULES_REFERENCE_POLICY}</td></tr>
 * <tr><td>{@code enabled-layers}</td><td>{@code FHIR_RULES_ENABLED_LAYERS}</td></tr>
 * <tr><td>{@code structural-schema}</td><td>{@code FHIR_RULES_STRUCTURAL_SCHEMA}</td></tr>
 * <tr><td>{@code telemetry-enabled}</td><td>{@code FHIR_RULES_TELEMETRY_ENABLED}</td></tr>
 * </table>
 */
public final class EngineConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_KEYS =
            Set.of("reference-policy", "enabled-layers", "structural-schema", "telemetry-enabled");

    static final String ENV_REFERENCE_POLICY = "FHIR_RULES_REFERENCE_POLICY";
    static final String ENV_ENABLED_LAYERS = "FHIR_RULES_ENABLED_LAYERS";
    static final String ENV_STRUCTURAL_SCHEMA = "FHIR_RULES_STRUCTURAL_SCHEMA";
    static final String ENV_TELEMETRY_ENABLED = "FHIR_RULES_TELEMETRY_ENABLED";

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, applying overrides from the
     * supplied lookup. A {@code null} return from {@code envLookup} means the
     * variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup, configPath.toString());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Builds configuration from environment variables only, e.g. when no file
     * is deployed.
     */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup, "environment");
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        EngineConfig.Builder builder = EngineConfig.builder();

        if (root != null && !root.isNull() && !root.isMissingNode()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + source);
            }
            rejectUnknownKeys(root, source);
            if (root.has("reference-policy")) {
                builder.referencePolicy(parsePolicy(root.get("reference-policy").asText(), source));
            }
            if (root.has("enabled-layers")) {
                builder.enabledLayers(parseLayers(root.get("enabled-layers"), source));
            }
            if (root.has("structural-schema")) {
                builder.structuralSchema(Path.of(root.get("structural-schema").asText()));
            }
            if (root.has("telemetry-enabled")) {
                JsonNode flag = root.get("telemetry-enabled");
                if (!flag.isBoolean()) {
                    throw new ConfigLoadException("'telemetry-enabled' must be true or false in " + source);
                }
                builder.telemetryEnabled(flag.booleanValue());
            }
        }

        // --- Environment variable overlay ---
        envString(envLookup, ENV_REFERENCE_POLICY, v -> builder.referencePolicy(parsePolicy(v, ENV_REFERENCE_POLICY)));
        envString(envLookup, ENV_ENABLED_LAYERS, v -> builder.enabledLayers(parseLayerList(v, ENV_ENABLED_LAYERS)));
        envString(envLookup, ENV_STRUCTURAL_SCHEMA, v -> builder.structuralSchema(Path.of(v)));
        envString(envLookup, ENV_TELEMETRY_ENABLED, v -> builder.telemetryEnabled(parseBoolean(v)));

        return builder.build();
    }

    private static void rejectUnknownKeys(JsonNode root, String source) {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                throw new ConfigLoadException(
                        "Unknown configuration key '" + name + "' in " + source + "; known keys: " + KNOWN_KEYS);
            }
        }
    }

    private static ReferencePolicy parsePolicy(String value, String source) {
        try {
            return ReferencePolicy.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage() + " (" + source + ")", e);
        }
    }

    private static Set<FindingSource> parseLayers(JsonNode node, String source) {
        if (node.isTextual()) {
            return parseLayerList(node.asText(), source);
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("'enabled-layers' must be a list in " + source);
        }
        Set<FindingSource> layers = EnumSet.noneOf(FindingSource.class);
        for (JsonNode item : node) {
            layers.add(parseLayer(item.asText(), source));
        }
        return layers;
    }

    private static Set<FindingSource> parseLayerList(String csv, String source) {
        Set<FindingSource> layers = EnumSet.noneOf(FindingSource.class);
        for (String name : csv.split(",")) {
            if (!name.isBlank()) {
                layers.add(parseLayer(name, source));
            }
        }
        return layers;
    }

    private static FindingSource parseLayer(String name, String source) {
        try {
            return FindingSource.fromWireName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage() + " (" + source + ")", e);
        }
    }

    private static boolean parseBoolean(String value) {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v)) {
            return false;
        }
        throw new ConfigLoadException(ENV_TELEMETRY_ENABLED + " must be true or false, got '" + value + "'");
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }
}
