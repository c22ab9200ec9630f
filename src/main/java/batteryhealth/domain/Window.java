package batteryhealth.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length slice of a device's feature matrix, paired with the sample that follows it.
 *
 * @param deviceId device the rows come from
 * @param features {@code windowSize x featureCount} matrix, oldest row first
 * @param targetTimestamp timestamp of the sample right after the window
 * @param sohTrue observed SoH (fraction) at the target sample
 * @param efcAtTarget equivalent full cycles at the target sample
 */
public record Window(
        String deviceId,
        double[][] features,
        Instant targetTimestamp,
        double sohTrue,
        double efcAtTarget
) {

    public Window {
        features = deepCopy(features);
    }

    @Override
    public double[][] features() {
        return deepCopy(features);
    }

    public int length() {
        return features.length;
    }

    public int featureCount() {
        return features.length == 0 ? 0 : features[0].length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Window other)) {
            return false;
        }
        return Objects.equals(deviceId, other.deviceId)
                && Arrays.deepEquals(features, other.features)
                && Objects.equals(targetTimestamp, other.targetTimestamp)
                && Double.compare(sohTrue, other.sohTrue) == 0
                && Double.compare(efcAtTarget, other.efcAtTarget) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, Arrays.deepHashCode(features), targetTimestamp, sohTrue, efcAtTarget);
    }

    @Override
    public String toString() {
        return "Window{deviceId=" + deviceId + ", rows=" + length() + ", features=" + featureCount()
                + ", targetTimestamp=" + targetTimestamp + ", sohTrue=" + sohTrue
                + ", efcAtTarget=" + efcAtTarget + "}";
    }

    private static double[][] deepCopy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
