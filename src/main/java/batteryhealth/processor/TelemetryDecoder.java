package batteryhealth.processor;

import batteryhealth.domain.TelemetrySample;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes a JSON payload of raw telemetry samples.
 * <p>
 * Accepts either a top-level array or an object wrapping the array in {@code "samples"} or
 * {@code "data"}. Parsing is lenient: unknown properties are ignored and non-JSON numeric
 * tokens such as {@code NaN} or {@code Infinity} are read as missing values.
 */
public class TelemetryDecoder {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryDecoder.class);

    private static final TypeReference<List<TelemetrySample>> SAMPLE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public TelemetryDecoder() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);
    }

    /**
     * Decode UTF-8 JSON into samples.
     *
     * @param payload the raw bytes
     * @return decoded samples in payload order
     * @throws IllegalArgumentException if the payload is not valid telemetry JSON
     */
    public List<TelemetrySample> decode(byte[] payload) {
        try {
            String json = cleanJsonString(new String(payload, StandardCharsets.UTF_8));
            JsonNode root = objectMapper.readTree(json);
            JsonNode samples = root;
            if (root != null && root.isObject()) {
                samples = root.has("samples") ? root.get("samples") : root.get("data");
            }
            if (samples == null || !samples.isArray()) {
                throw new IllegalArgumentException("Expected a JSON array of telemetry samples");
            }
            List<TelemetrySample> decoded = objectMapper.convertValue(samples, SAMPLE_LIST);
            logger.debug("Decoded {} telemetry samples", decoded.size());
            return decoded;
        } catch (IllegalArgumentException e) {
            logger.error("Failed to decode telemetry payload: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            logger.error("Failed to decode telemetry payload", e);
            throw new IllegalArgumentException("Telemetry decoding failed: " + e.getMessage(), e);
        }
    }

    /**
     * Strip control characters and turn NaN/Infinity tokens into null.
     */
    private String cleanJsonString(String jsonString) {
        // keep \t \n \r, they are legal whitespace between tokens
        jsonString = jsonString.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        // only bare value tokens, never text inside a string
        jsonString = jsonString.replaceAll(
                "(?i)([:\\[,]\\s*)[+\\-]?(?:nan|infinity|inf)(?=\\s*[,}\\]])", "$1null");
        return jsonString;
    }
}
