package batteryhealth.prediction;

import batteryhealth.domain.DeviceReport;
import batteryhealth.domain.DeviceStatus;
import batteryhealth.domain.PipelineReport;
import batteryhealth.domain.RulEstimate;
import batteryhealth.domain.Window;
import batteryhealth.processor.NumericGuards;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Feeds a device's windows through the scaler and the SoH model, then turns the latest
 * prediction into a remaining-useful-life estimate and an expiry date.
 */
public class PredictionService {
    private static final Logger logger = LoggerFactory.getLogger(PredictionService.class);

    private final FeatureScaler scaler;
    private final SohModel model;
    private final RulEstimator rulEstimator;
    private final ExpiryDateCalculator expiryDateCalculator;

    public PredictionService(FeatureScaler scaler, SohModel model, RulEstimator rulEstimator,
                             ExpiryDateCalculator expiryDateCalculator) {
        this.scaler = Objects.requireNonNull(scaler, "scaler cannot be null");
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.rulEstimator = Objects.requireNonNull(rulEstimator, "rulEstimator cannot be null");
        this.expiryDateCalculator = Objects.requireNonNull(expiryDateCalculator,
                "expiryDateCalculator cannot be null");
    }

    public List<PredictionResult> predictAll(PipelineReport report) {
        List<PredictionResult> results = new ArrayList<>(report.devices().size());
        for (DeviceReport device : report.devices()) {
            results.add(predict(device));
        }
        return results;
    }

    /**
     * Predict SoH for every window of a device.
     *
     * @return the prediction, or an {@link DeviceStatus#INSUFFICIENT_DATA} result when the device
     *         has no window
     * @throws IllegalStateException if the model returns a different number of predictions than windows
     */
    public PredictionResult predict(DeviceReport device) {
        List<Window> windows = device.windows();
        if (windows.isEmpty()) {
            String message = device.reason() != null ? device.reason() : "no windows to predict from";
            logger.info("Skipping prediction for device {}: {}", device.deviceId(), message);
            return PredictionResult.insufficient(device.deviceId(), message);
        }

        double[][][] input = new double[windows.size()][][];
        for (int i = 0; i < windows.size(); i++) {
            input[i] = scaler.transform(windows.get(i).features());
        }

        double[] predictions = model.predict(input);
        if (predictions == null || predictions.length != windows.size()) {
            throw new IllegalStateException("Model returned " + (predictions == null ? 0 : predictions.length)
                    + " predictions for " + windows.size() + " windows");
        }

        List<SohPredictionPoint> series = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            Window window = windows.get(i);
            series.add(new SohPredictionPoint(
                    window.targetTimestamp(),
                    NumericGuards.finiteOr(window.sohTrue() * 100.0, 0.0),
                    NumericGuards.finiteOr(predictions[i] * 100.0, 0.0)));
        }

        double last = predictions[predictions.length - 1];
        RulEstimate rul = rulEstimator.estimate(last);
        Instant expiry = expiryDateCalculator.expiryDate(rul.months());

        logger.debug("Device {}: SoH prediction {} over {} windows, RUL {} cycles",
                device.deviceId(), last, windows.size(), rul.cycles());
        return new PredictionResult(
                device.deviceId(),
                DeviceStatus.OK,
                "Prediction successful",
                NumericGuards.finiteOr(last, 0.0),
                NumericGuards.finiteOr(last * 100.0, 0.0),
                rul,
                expiry,
                List.copyOf(series));
    }
}
