package batteryhealth.processor;

import batteryhealth.domain.CycleSeries;
import batteryhealth.domain.DeviceSeries;
import batteryhealth.domain.FeatureTable;
import batteryhealth.domain.SohSeries;
import batteryhealth.domain.ThroughputEnergyRecord;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static batteryhealth.domain.FeatureColumns.*;

/**
 * Left-joins the throughput/energy branch onto the SoH/cycle branch on (device id, timestamp).
 * Samples without a throughput record keep NaN in the throughput columns.
 */
public class FeatureMerger {

    public FeatureTable merge(DeviceSeries series, SohSeries soh, CycleSeries cycles,
                              List<ThroughputEnergyRecord> throughputEnergy) {
        int n = series.size();
        Map<String, double[]> columns = new LinkedHashMap<>();

        columns.put(BATTERY_LEVEL, series.batteryLevel());
        columns.put(DELTA_T_S, SeriesMath.fillMissing(series.deltaTSeconds(), 0.0));
        columns.put(BATT_VOLTAGE_V, SeriesMath.scale(series.battVoltageMv(), 1.0 / 1000.0));
        columns.put(BATT_CURRENT_A, SeriesMath.scale(series.currentAvgUa(), 1.0 / 1e6));
        columns.put(BATT_TEMP_C, series.battTempC());

        columns.put(Q_MAH, soh.chargeMah());
        columns.put(Q_MAH_RAW, soh.rawChargeMah());
        columns.put(CT_MAH, soh.capacityMah());
        columns.put(FULL_BLOCK_ID, soh.fullBlockId());
        columns.put(SOH, soh.soh());
        columns.put(SOH_SMOOTH, soh.sohSmooth());
        columns.put(SOH_PCT, soh.sohPct());
        columns.put(SOH_SMOOTH_PCT, soh.sohSmoothPct());
        columns.put(DELTA_Q_MAH, cycles.deltaQMah());
        columns.put(DISCHARGE_MAH, cycles.dischargeMah());
        columns.put(EFC, cycles.efc());

        // first record wins if a timestamp repeats
        Map<Instant, ThroughputEnergyRecord> byTimestamp = new HashMap<>();
        for (ThroughputEnergyRecord record : throughputEnergy) {
            byTimestamp.putIfAbsent(record.timestamp(), record);
        }

        double[] upload = SeriesMath.nanArray(n);
        double[] download = SeriesMath.nanArray(n);
        double[] totalBps = SeriesMath.nanArray(n);
        double[] totalMbps = SeriesMath.nanArray(n);
        double[] energy = SeriesMath.nanArray(n);
        double[] energyPerBit = SeriesMath.nanArray(n);
        double[] bot = SeriesMath.nanArray(n);
        List<Instant> timestamps = series.timestamps();
        for (int i = 0; i < n; i++) {
            ThroughputEnergyRecord record = byTimestamp.get(timestamps.get(i));
            if (record == null) {
                continue;
            }
            upload[i] = record.throughputUploadMbps();
            download[i] = record.throughputDownloadMbps();
            totalBps[i] = record.throughputTotalBps();
            totalMbps[i] = record.throughputTotalMbps();
            energy[i] = record.energyWh();
            energyPerBit[i] = record.energyPerBitAvgJ();
            bot[i] = record.botMahPerGbps();
        }
        columns.put(THROUGHPUT_UPLOAD_MBPS, upload);
        columns.put(THROUGHPUT_DOWNLOAD_MBPS, download);
        columns.put(THROUGHPUT_TOTAL_BPS, totalBps);
        columns.put(THROUGHPUT_TOTAL_MBPS, totalMbps);
        columns.put(ENERGY_WH, energy);
        columns.put(ENERGY_PER_BIT_AVG_J, energyPerBit);
        columns.put(BOT_MAH_PER_GBPS, bot);

        return new FeatureTable(series.deviceId(), timestamps, columns);
    }
}
