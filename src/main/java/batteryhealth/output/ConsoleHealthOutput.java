package batteryhealth.output;

import batteryhealth.domain.DeviceStatus;
import batteryhealth.domain.PipelineReport;
import batteryhealth.domain.SohSummary;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Console output of pipeline reports, compact (one line per device) or verbose.
 */
public class ConsoleHealthOutput implements HealthOutput {

    private static final int COMPACT_DEVICE_LIMIT = 5;

    private final boolean verbose;
    private final boolean colorized;
    private final DateTimeFormatter timeFormatter;

    // ANSI color codes
    private static final class Colors {
        static final String RESET = "\u001B[0m";
        static final String BRIGHT = "\u001B[1m";
        static final String DIM = "\u001B[2m";
        static final String RED = "\u001B[31m";
        static final String GREEN = "\u001B[32m";
        static final String YELLOW = "\u001B[33m";
        static final String CYAN = "\u001B[36m";
    }

    /**
     * @param verbose if true, print every summary field; if false, one line per device
     * @param colorized if true, use ANSI colors
     */
    public ConsoleHealthOutput(boolean verbose, boolean colorized) {
        this.verbose = verbose;
        this.colorized = colorized;
        this.timeFormatter = DateTimeFormatter.ISO_LOCAL_DATE_TIME
                .withZone(ZoneId.systemDefault());
    }

    /**
     * Compact, colorized output.
     */
    public ConsoleHealthOutput() {
        this(false, true);
    }

    @Override
    public void send(PipelineReport report) {
        try {
            if (verbose) {
                printVerbose(report);
            } else {
                printCompact(report);
            }
        } catch (Exception e) {
            System.err.println("Console output error: " + e.getMessage());
            return;
        }
        // PrintStream swallows IOExceptions and only reports them through checkError()
        if (System.out.checkError()) {
            System.err.println("Console output error: write failure");
        }
    }

    @Override
    public void close() {
        // No resources to close for console output
    }

    private void printVerbose(PipelineReport report) {
        String cyan = color(Colors.CYAN);
        String bright = color(Colors.BRIGHT);
        String yellow = color(Colors.YELLOW);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);

        System.out.println(cyan + "━".repeat(60) + reset);
        System.out.println(bright + "BATTERY HEALTH REPORT" + reset);
        System.out.println(cyan + "━".repeat(60) + reset);
        System.out.println(yellow + "Generated:" + reset + " " + timeFormatter.format(report.generatedAt()));
        System.out.println(yellow + "Devices:" + reset + " " + report.devices().size()
                + " (" + report.okDevices() + " ok)");
        System.out.println(yellow + "Windows:" + reset + " " + report.totalWindows());
        if (report.droppedSamples() > 0) {
            System.out.println(yellow + "Dropped samples:" + reset + " " + report.droppedSamples());
        }
        System.out.println();

        for (SohSummary summary : report.summaries()) {
            System.out.println(statusColor(summary.status()) + summary.deviceId() + reset
                    + " " + dim + "[" + summary.status() + "]" + reset);
            System.out.println(dim + "─".repeat(50) + reset);
            if (summary.reason() != null) {
                System.out.println("  Reason:        " + summary.reason());
            }
            System.out.println("  Source:        " + summary.source());
            System.out.println("  C0_ref:        " + format(summary.referenceCapacityMah(), "mAh"));
            System.out.println("  Full charges:  " + summary.fullChargeBlocks());
            System.out.println("  SoH:           " + format(summary.latestSohPct(), "%"));
            System.out.println("  SoH smoothed:  " + format(summary.latestSohSmoothPct(), "%"));
            System.out.println("  EFC:           " + format(summary.totalEfc(), "cycles"));
            System.out.println("  Samples:       " + summary.series().size());
            System.out.println("  Windows:       " + summary.windows());
            System.out.println();
        }
    }

    private void printCompact(PipelineReport report) {
        String bright = color(Colors.BRIGHT);
        String cyan = color(Colors.CYAN);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);

        System.out.println(bright + "[" + timeFormatter.format(report.generatedAt())
                + "] Battery Health - " + report.devices().size() + " devices" + reset);

        int devicesToShow = Math.min(COMPACT_DEVICE_LIMIT, report.devices().size());
        for (int i = 0; i < devicesToShow; i++) {
            SohSummary summary = report.devices().get(i).summary();
            System.out.println("  " + cyan + summary.deviceId() + ":" + reset + " SoH "
                    + format(summary.latestSohSmoothPct(), "%") + ", EFC " + format(summary.totalEfc(), "")
                    .trim() + " " + dim + "(" + summary.status() + ")" + reset);
        }

        if (report.devices().size() > COMPACT_DEVICE_LIMIT) {
            System.out.println("  " + dim + "... and "
                    + (report.devices().size() - COMPACT_DEVICE_LIMIT) + " more devices" + reset);
        }
    }

    private String statusColor(DeviceStatus status) {
        return switch (status) {
            case OK -> color(Colors.GREEN);
            case INSUFFICIENT_DATA -> color(Colors.RED);
        };
    }

    private static String format(Double value, String unit) {
        if (value == null) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.2f %s", value, unit);
    }

    /**
     * Apply color if colorization is enabled.
     */
    private String color(String colorCode) {
        return colorized ? colorCode : "";
    }
}
