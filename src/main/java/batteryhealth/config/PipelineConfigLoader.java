package batteryhealth.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link PipelineConfig} from JSON.
 * <p>
 * Keys use snake_case ({@code window_size}, {@code hampel_k}, {@code nominal_capacity_table}, ...).
 * Absent keys keep their defaults and unknown keys are ignored, so the same file can carry
 * settings meant for other components.
 */
public final class PipelineConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "pipeline-config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.ALLOW_COMMENTS);

    /**
     * Load the configuration bundled on the classpath.
     *
     * @throws PipelineConfigurationException if the resource is missing or invalid
     */
    public static PipelineConfig loadDefault() {
        try (InputStream input = PipelineConfigLoader.class.getClassLoader()
                .getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new PipelineConfigurationException(DEFAULT_RESOURCE + " not found on the classpath");
            }
            return load(input);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Load the configuration from a file.
     *
     * @throws PipelineConfigurationException if the file cannot be read or is invalid
     */
    public static PipelineConfig load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            logger.info("Loading pipeline configuration from {}", path);
            return load(input);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to read configuration file " + path, e);
        }
    }

    /**
     * Load the configuration from a stream. The stream is not closed.
     */
    public static PipelineConfig load(InputStream input) {
        JsonNode root;
        try {
            root = MAPPER.readTree(input);
        } catch (IOException e) {
            throw new PipelineConfigurationException("Malformed configuration JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PipelineConfigurationException("Configuration must be a JSON object");
        }
        return fromTree(root);
    }

    static PipelineConfig fromTree(JsonNode root) {
        PipelineConfig.Builder builder = PipelineConfig.builder();

        if (root.has("window_size")) {
            builder.windowSize(intValue(root, "window_size"));
        }
        if (root.has("feature_cols")) {
            builder.featureCols(stringList(root, "feature_cols"));
        }
        if (root.has("zscore_cols")) {
            builder.zscoreCols(stringList(root, "zscore_cols"));
        }
        if (root.has("nominal_capacity_table")) {
            builder.nominalCapacityTable(capacityTable(root.get("nominal_capacity_table")));
        }
        if (root.has("default_capacity")) {
            builder.defaultCapacity(doubleValue(root, "default_capacity"));
        }
        if (root.has("full_charge_threshold")) {
            builder.fullChargeThreshold(doubleValue(root, "full_charge_threshold"));
        }
        if (root.has("hampel_k")) {
            builder.hampelK(intValue(root, "hampel_k"));
        }
        if (root.has("hampel_nsigma")) {
            builder.hampelNsigma(doubleValue(root, "hampel_nsigma"));
        }
        if (root.has("ema_fast_span")) {
            builder.emaFastSpan(intValue(root, "ema_fast_span"));
        }
        if (root.has("ema_slow_span")) {
            builder.emaSlowSpan(intValue(root, "ema_slow_span"));
        }
        if (root.has("missing_feature_value")) {
            builder.missingFeatureValue(doubleValue(root, "missing_feature_value"));
        }

        // RUL constants may sit at the top level or in a nested "rul_config" block
        JsonNode rul = root.path("rul_config");
        JsonNode kGlobal = firstPresent(root.get("rul_k_global"), rul.get("k_global"));
        JsonNode sohEol = firstPresent(root.get("rul_soh_eol"), rul.get("soh_eol"));
        JsonNode hoursPerCycle = firstPresent(root.get("rul_hours_per_cycle"), rul.get("hours_per_cycle"));
        if (kGlobal != null) {
            builder.rulKGlobal(requireNumber(kGlobal, "rul_k_global"));
        }
        if (sohEol != null) {
            builder.rulSohEol(requireNumber(sohEol, "rul_soh_eol"));
        }
        if (hoursPerCycle != null) {
            builder.rulHoursPerCycle(requireNumber(hoursPerCycle, "rul_hours_per_cycle"));
        }

        PipelineConfig config = builder.build();
        logger.debug("Pipeline configuration loaded: windowSize={}, features={}, nominalCapacities={}",
                config.windowSize(), config.featureCols().size(), config.nominalCapacityTable().size());
        return config;
    }

    private static JsonNode firstPresent(JsonNode first, JsonNode second) {
        if (first != null && !first.isNull()) {
            return first;
        }
        return second != null && !second.isNull() ? second : null;
    }

    private static int intValue(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new PipelineConfigurationException(key + " must be an integer, got " + node);
        }
        return node.intValue();
    }

    private static double doubleValue(JsonNode root, String key) {
        return requireNumber(root.get(key), key);
    }

    private static double requireNumber(JsonNode node, String key) {
        if (node == null || !node.isNumber()) {
            throw new PipelineConfigurationException(key + " must be a number, got " + node);
        }
        return node.doubleValue();
    }

    private static List<String> stringList(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isArray()) {
            throw new PipelineConfigurationException(key + " must be an array of column names");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new PipelineConfigurationException(key + " must only contain strings, got " + item);
            }
            values.add(item.asText());
        }
        return values;
    }

    private static Map<String, Double> capacityTable(JsonNode node) {
        if (!node.isObject()) {
            throw new PipelineConfigurationException("nominal_capacity_table must be an object");
        }
        Map<String, Double> table = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            table.put(entry.getKey(), requireNumber(entry.getValue(), "nominal_capacity_table." + entry.getKey()));
        }
        return table;
    }

    private PipelineConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }
}
