package batteryhealth.input;

import batteryhealth.domain.TelemetrySample;
import batteryhealth.processor.TelemetryDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads one JSON file of telemetry samples and delivers it as a single batch when started.
 */
public class JsonFileTelemetryInput implements TelemetryInput {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileTelemetryInput.class);

    private final Path file;
    private final TelemetryDecoder decoder;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile BatchListener listener;

    public JsonFileTelemetryInput(Path file, TelemetryDecoder decoder) {
        this.file = Objects.requireNonNull(file, "file cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
    }

    public JsonFileTelemetryInput(Path file) {
        this(file, new TelemetryDecoder());
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        List<TelemetrySample> samples;
        try {
            samples = decoder.decode(Files.readAllBytes(file));
        } catch (IOException e) {
            running.set(false);
            throw new IllegalStateException("Failed to read telemetry file " + file, e);
        } catch (IllegalArgumentException e) {
            running.set(false);
            throw e;
        }
        logger.info("Read {} telemetry samples from {}", samples.size(), file);

        BatchListener current = listener;
        if (current == null) {
            logger.warn("No batch listener registered, {} samples discarded", samples.size());
            return;
        }
        current.onBatchReceived(samples);
    }

    @Override
    public void stop() {
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void setBatchListener(BatchListener listener) {
        this.listener = listener;
    }

    public Path file() {
        return file;
    }
}
