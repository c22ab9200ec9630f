package batteryhealth.prediction;

import batteryhealth.config.PipelineConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Standardisation {@code (x - mean) / scale} with per-feature constants fitted offline.
 * A zero scale is treated as 1, so a feature that was constant during fitting is only centred.
 */
public class StandardFeatureScaler implements FeatureScaler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final double[] mean;
    private final double[] scale;

    public StandardFeatureScaler(double[] mean, double[] scale) {
        if (mean == null || scale == null || mean.length != scale.length || mean.length == 0) {
            throw new PipelineConfigurationException("Scaler mean and scale must be non-empty and of equal length");
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
        for (int i = 0; i < this.scale.length; i++) {
            if (!Double.isFinite(this.mean[i]) || !Double.isFinite(this.scale[i])) {
                throw new PipelineConfigurationException("Scaler constants must be finite (feature " + i + ")");
            }
            if (this.scale[i] == 0.0) {
                this.scale[i] = 1.0;
            }
        }
    }

    /**
     * Read {@code {"mean": [...], "scale": [...]}}.
     */
    public static StandardFeatureScaler fromJson(InputStream input) {
        try {
            JsonNode root = MAPPER.readTree(input);
            if (root == null || !root.isObject()) {
                throw new PipelineConfigurationException("Scaler definition must be a JSON object");
            }
            return new StandardFeatureScaler(array(root, "mean"), array(root, "scale"));
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to read scaler definition", e);
        }
    }

    private static double[] array(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || !node.isArray()) {
            throw new PipelineConfigurationException("Scaler definition lacks array '" + key + "'");
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            if (!node.get(i).isNumber()) {
                throw new PipelineConfigurationException("Scaler '" + key + "' must only contain numbers");
            }
            values[i] = node.get(i).doubleValue();
        }
        return values;
    }

    @Override
    public double[][] transform(double[][] window) {
        double[][] scaled = new double[window.length][];
        for (int r = 0; r < window.length; r++) {
            if (window[r].length != mean.length) {
                throw new IllegalArgumentException("Window row has " + window[r].length
                        + " features, scaler was fitted on " + mean.length);
            }
            scaled[r] = new double[mean.length];
            for (int c = 0; c < mean.length; c++) {
                scaled[r][c] = (window[r][c] - mean[c]) / scale[c];
            }
        }
        return scaled;
    }

    public int featureCount() {
        return mean.length;
    }
}
