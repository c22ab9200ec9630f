package batteryhealth.domain;

import java.util.List;

/**
 * Column names of the merged per-sample feature table.
 * Names follow the ones the downstream sequence model was trained with.
 */
public final class FeatureColumns {

    // Raw, converted to SI-ish units
    public static final String BATTERY_LEVEL = "battery_level";
    public static final String DELTA_T_S = "delta_t_s";
    public static final String BATT_VOLTAGE_V = "batt_voltage_v";
    public static final String BATT_CURRENT_A = "batt_current_a";
    public static final String BATT_TEMP_C = "batt_temp_c";

    // Capacity and cycles
    public static final String Q_MAH = "Q_mAh";
    public static final String Q_MAH_RAW = "Q_mAh_raw";
    public static final String CT_MAH = "Ct_mAh";
    public static final String FULL_BLOCK_ID = "full_block_id";
    public static final String SOH = "SoH";
    public static final String SOH_SMOOTH = "SoH_smooth";
    public static final String SOH_PCT = "SoH_pct";
    public static final String SOH_SMOOTH_PCT = "SoH_smooth_pct";
    public static final String DELTA_Q_MAH = "delta_Q_mAh";
    public static final String DISCHARGE_MAH = "discharge_mAh";
    public static final String EFC = "EFC";

    // Throughput and energy
    public static final String THROUGHPUT_UPLOAD_MBPS = "throughput_upload_mbps";
    public static final String THROUGHPUT_DOWNLOAD_MBPS = "throughput_download_mbps";
    public static final String THROUGHPUT_TOTAL_BPS = "throughput_total_bps";
    public static final String THROUGHPUT_TOTAL_MBPS = "throughput_total_mbps";
    public static final String ENERGY_WH = "energy_wh";
    public static final String ENERGY_PER_BIT_AVG_J = "energy_per_bit_avg_J";
    public static final String BOT_MAH_PER_GBPS = "BoT_mAh_per_Gbps";

    // Aging features
    public static final String SOH_FILLED = "SoH_filled";
    public static final String SOH_EMA_FAST = "soh_ema_fast";
    public static final String SOH_EMA_SLOW = "soh_ema_slow";
    public static final String SOH_TREND = "soh_trend";
    public static final String EFC_DELTA = "efc_delta";
    public static final String TEMP_EMA = "temp_ema";
    public static final String TEMP_MAX_WIN = "temp_max_win";
    public static final String TP_EMA = "tp_ema";
    public static final String EPB_EMA = "epb_ema";

    public static final String Z_SUFFIX = "_z";

    /**
     * Columns that receive a per-device z-score by default.
     */
    public static final List<String> AGING_BASE_COLS = List.of(
            BATT_VOLTAGE_V,
            BATT_TEMP_C,
            THROUGHPUT_TOTAL_MBPS,
            ENERGY_PER_BIT_AVG_J,
            SOH_FILLED,
            EFC,
            SOH_TREND,
            EFC_DELTA,
            TEMP_EMA,
            TEMP_MAX_WIN,
            TP_EMA,
            EPB_EMA
    );

    /**
     * Model input columns, in the order the model expects them.
     */
    public static final List<String> MODEL_FEATURE_COLS = List.of(
            BATT_VOLTAGE_V, BATT_TEMP_C,
            THROUGHPUT_TOTAL_MBPS, ENERGY_PER_BIT_AVG_J,
            EFC, SOH_TREND, EFC_DELTA,
            TEMP_EMA, TEMP_MAX_WIN, TP_EMA, EPB_EMA,
            zscore(BATT_VOLTAGE_V), zscore(BATT_TEMP_C),
            zscore(THROUGHPUT_TOTAL_MBPS), zscore(ENERGY_PER_BIT_AVG_J),
            zscore(SOH_FILLED), zscore(EFC), zscore(SOH_TREND), BOT_MAH_PER_GBPS
    );

    public static String zscore(String column) {
        return column + Z_SUFFIX;
    }

    private FeatureColumns() {
        throw new UnsupportedOperationException("Utility class");
    }
}
