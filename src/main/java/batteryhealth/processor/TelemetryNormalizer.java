package batteryhealth.processor;

import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.NormalizedTelemetry;
import batteryhealth.domain.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Partitions raw samples by device, parses timestamps, sorts each device ascending
 * and computes the elapsed time between consecutive samples.
 */
public class TelemetryNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryNormalizer.class);

    /** Gaps longer than this are not physical sampling intervals. */
    public static final double MAX_GAP_SECONDS = 3600.0;

    // "2024-05-01 12:30:00", "2024-05-01T12:30:00.123" or "2024-05-01 12:30:00+00"; UTC without an offset
    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HH", "Z").optionalEnd()
            .toFormatter();

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            TelemetryNormalizer::parseDateTime,
            TelemetryNormalizer::parseEpochSeconds
    );

    /**
     * Normalize a batch that may mix several devices.
     * Devices left without samples are excluded from the result.
     *
     * @param samples raw samples in arrival order
     * @return series keyed by device id
     */
    public NormalizedTelemetry normalize(List<TelemetrySample> samples) {
        Map<String, List<ParsedSample>> byDevice = new TreeMap<>();
        int dropped = 0;

        for (TelemetrySample sample : samples) {
            if (sample == null || sample.deviceId() == null || sample.deviceId().isBlank()) {
                dropped++;
                continue;
            }
            Optional<Instant> timestamp = parseTimestamp(sample.timestamp());
            if (timestamp.isEmpty()) {
                logger.warn("Dropping sample of device {} with unparseable timestamp '{}'",
                        sample.deviceId(), sample.timestamp());
                dropped++;
                continue;
            }
            byDevice.computeIfAbsent(sample.deviceId(), id -> new ArrayList<>())
                    .add(new ParsedSample(timestamp.get(), sample));
        }

        Map<String, DeviceSeries> devices = new LinkedHashMap<>();
        for (Map.Entry<String, List<ParsedSample>> entry : byDevice.entrySet()) {
            DeviceSeries series = toSeries(entry.getKey(), entry.getValue());
            if (!series.isEmpty()) {
                devices.put(entry.getKey(), series);
            }
        }

        if (dropped > 0) {
            logger.warn("Dropped {} of {} samples during normalization", dropped, samples.size());
        }
        logger.debug("Normalized {} samples into {} device series", samples.size() - dropped, devices.size());
        return new NormalizedTelemetry(Collections.unmodifiableMap(devices), dropped);
    }

    /**
     * Normalize the samples of a single device.
     *
     * @return the sorted series, or empty when no sample survives parsing
     */
    public Optional<DeviceSeries> normalizeDevice(String deviceId, List<TelemetrySample> samples) {
        return Optional.ofNullable(normalize(samples).devices().get(deviceId));
    }

    private DeviceSeries toSeries(String deviceId, List<ParsedSample> parsed) {
        // stable sort keeps arrival order for equal timestamps
        List<ParsedSample> sorted = new ArrayList<>(parsed);
        sorted.sort(Comparator.comparing(ParsedSample::timestamp));

        List<Instant> timestamps = new ArrayList<>(sorted.size());
        List<TelemetrySample> ordered = new ArrayList<>(sorted.size());
        double[] deltaT = new double[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            ParsedSample current = sorted.get(i);
            timestamps.add(current.timestamp());
            ordered.add(current.sample());
            deltaT[i] = i == 0 ? Double.NaN : elapsedSeconds(sorted.get(i - 1).timestamp(), current.timestamp());
        }
        return DeviceSeries.fromSorted(deviceId, timestamps, ordered, deltaT);
    }

    /**
     * Seconds between two samples; negative or over-long gaps count as 0.
     */
    static double elapsedSeconds(Instant previous, Instant current) {
        double seconds = Duration.between(previous, current).toNanos() / 1e9;
        if (seconds < 0 || seconds > MAX_GAP_SECONDS) {
            return 0.0;
        }
        return seconds;
    }

    /**
     * Parse ISO-8601 instants, offset date-times, local date-times (UTC) and epoch seconds.
     */
    static Optional<Instant> parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            Optional<Instant> parsed = tryParse(parser, text);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> tryParse(Function<String, Instant> parser, String text) {
        try {
            return Optional.ofNullable(parser.apply(text));
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Instant parseDateTime(String text) {
        TemporalAccessor parsed = DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static Instant parseEpochSeconds(String text) {
        double epochSeconds = Double.parseDouble(text);
        if (!Double.isFinite(epochSeconds)) {
            return null;
        }
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1e9);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private record ParsedSample(Instant timestamp, TelemetrySample sample) {
    }
}
