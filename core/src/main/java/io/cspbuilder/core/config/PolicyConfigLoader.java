package io.cspbuilder.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.cspbuilder.core.error.ConfigParseException;
import io.cspbuilder.core.error.ConfigValidationException;
import io.cspbuilder.core.model.DirectiveValue;
import io.cspbuilder.core.model.Directives;
import io.cspbuilder.core.model.PolicyConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link PolicyConfig} from a YAML settings file with optional
 * environment variable overlay.
 *
 * <p>
 * Example:
 *
 * <pre>
 * directives:
 *   default-src: ["'self'"]
 *   script-src: ["'self'", cdn.example.com]
 *   upgrade-insecure-requests: true
 *   report-uri: /csp-report
 * include-nonce-in: [default-src, script-src]
 * report-only: false
 * report-percentage: 10
 * exclude-url-prefixes: [/admin]
 * </pre>
 *
 * <p>
 * The document is validated against {@code schema/csp-config.schema.json}.
 * Directives start from the default table: known directives keep their
 * {@link Directives#KNOWN} order, a {@code null} entry removes a default, and
 * unknown directive names follow in document order. Missing top-level keys
 * take the {@link PolicyConfig#defaults()} values.
 *
 * <p>
 * Environment overlay: {@code CSP_REPORT_ONLY}, {@code CSP_REPORT_PERCENTAGE},
 * {@code CSP_INCLUDE_NONCE_IN} and {@code CSP_EXCLUDE_URL_PREFIXES} (lists are
 * comma-separated) take precedence over the file. A variable counts as set
 * only if it is defined and non-blank after trimming.
 */
public final class PolicyConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schema/csp-config.schema.json";
    private static final JsonSchema SETTINGS_SCHEMA = loadSchema();

    static final String ENV_REPORT_ONLY = "CSP_REPORT_ONLY";
    static final String ENV_REPORT_PERCENTAGE = "CSP_REPORT_PERCENTAGE";
    static final String ENV_INCLUDE_NONCE_IN = "CSP_INCLUDE_NONCE_IN";
    static final String ENV_EXCLUDE_URL_PREFIXES = "CSP_EXCLUDE_URL_PREFIXES";

    private PolicyConfigLoader() {
        // utility class
    }

    /**
     * Loads settings from the given file, applying overrides from
     * {@link System#getenv}.
     *
     * @param configPath path to the YAML settings file
     * @return the loaded configuration
     * @throws ConfigParseException      if the file is missing or not valid YAML
     * @throws ConfigValidationException if the document violates the schema
     */
    public static PolicyConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads settings from the given file, applying overrides from the supplied
     * lookup. The lookup returns {@code null} for undefined variables.
     *
     * @param configPath path to the YAML settings file
     * @param envLookup  environment variable lookup function
     * @return the loaded configuration
     * @throws ConfigParseException      if the file is missing, not valid YAML,
     *                                   or an override is malformed
     * @throws ConfigValidationException if the document violates the schema
     */
    public static PolicyConfig load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new ConfigParseException("Policy settings file not found: " + configPath, source);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return fromTree(YAML_MAPPER.readTree(in), source, envLookup);
        } catch (IOException e) {
            throw new ConfigParseException("Failed to parse policy settings YAML: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses settings from in-memory YAML text. No environment overlay is
     * applied.
     *
     * @param yaml   the YAML document
     * @param source identifier used in log lines and error messages
     * @return the loaded configuration
     */
    public static PolicyConfig parse(String yaml, String source) {
        return parse(yaml, source, name -> null);
    }

    /**
     * Parses settings from in-memory YAML text with the given environment
     * lookup.
     */
    public static PolicyConfig parse(String yaml, String source, Function<String, String> envLookup) {
        try {
            return fromTree(YAML_MAPPER.readTree(yaml), source, envLookup);
        } catch (IOException e) {
            throw new ConfigParseException("Failed to parse policy settings YAML: " + e.getMessage(), e, source);
        }
    }

    // --- Private helpers ---

    private static PolicyConfig fromTree(JsonNode root, String source, Function<String, String> envLookup) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        validate(root, source);

        PolicyConfig.Builder builder = PolicyConfig.builder();
        applyDirectives(builder, root.path("directives"));

        if (root.has("include-nonce-in")) builder.includeNonceIn(textList(root.get("include-nonce-in")));
        if (root.has("report-only")) builder.reportOnly(root.get("report-only").asBoolean());
        if (root.has("report-percentage")) builder.reportPercentage(root.get("report-percentage").asInt());
        if (root.has("exclude-url-prefixes"))
            builder.excludeUrlPrefixes(textList(root.get("exclude-url-prefixes")));

        applyEnvOverrides(builder, envLookup, source);

        PolicyConfig config;
        try {
            config = builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException("Invalid policy settings: " + e.getMessage(), e, source);
        }
        LOG.info(
                "Loaded policy settings: source={}, directives={}, reportOnly={}",
                source,
                config.directives().size(),
                config.reportOnly());
        return config;
    }

    private static void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = SETTINGS_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            List<String> violations =
                    errors.stream().map(ValidationMessage::getMessage).sorted().toList();
            throw new ConfigValidationException(
                    "Policy settings do not match schema: " + String.join("; ", violations), violations, source);
        }
    }

    /**
     * Overlays the document's directives on the default table. Known names are
     * kept in {@link Directives#KNOWN} order, unknown names are appended in
     * document order.
     */
    private static void applyDirectives(PolicyConfig.Builder builder, JsonNode directivesNode) {
        if (!directivesNode.isObject()) {
            return;
        }
        Map<String, JsonNode> declared = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = directivesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            declared.put(field.getKey(), field.getValue());
        }

        PolicyConfig defaults = PolicyConfig.defaults();
        builder.clearDirectives();
        for (String name : Directives.KNOWN) {
            if (declared.containsKey(name)) {
                builder.directive(name, toDirectiveValue(declared.remove(name)));
            } else {
                builder.directive(name, defaults.directives().get(name));
            }
        }
        declared.forEach((name, node) -> builder.directive(name, toDirectiveValue(node)));
    }

    private static DirectiveValue toDirectiveValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(scalar(element)));
            return DirectiveValue.of(elements);
        }
        return DirectiveValue.of(scalar(node));
    }

    private static Object scalar(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        } else if (!node.isNull()) {
            values.add(node.asText());
        }
        return values;
    }

    // --- Env var helpers ---

    private static void applyEnvOverrides(
            PolicyConfig.Builder builder, Function<String, String> envLookup, String source) {
        envValue(envLookup, ENV_REPORT_ONLY, value -> builder.reportOnly(Boolean.parseBoolean(value)));
        envValue(envLookup, ENV_REPORT_PERCENTAGE, value -> {
            try {
                builder.reportPercentage(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigParseException(
                        ENV_REPORT_PERCENTAGE + " must be an integer, got: " + value, e, source);
            }
        });
        envValue(envLookup, ENV_INCLUDE_NONCE_IN, value -> builder.includeNonceIn(splitList(value)));
        envValue(envLookup, ENV_EXCLUDE_URL_PREFIXES, value -> builder.excludeUrlPrefixes(splitList(value)));
    }

    /** Applies an env var override if it is defined and non-blank. */
    private static void envValue(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        String value = envLookup.apply(envVar);
        if (value != null && !value.trim().isEmpty()) {
            LOG.debug("Applying environment override: {}", envVar);
            setter.accept(value.trim());
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = PolicyConfigLoader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }
}
