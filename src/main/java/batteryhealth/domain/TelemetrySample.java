package batteryhealth.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw telemetry sample as reported by a smartphone agent.
 * Every measurement is optional; the timestamp is kept as received and parsed during normalization.
 */
public record TelemetrySample(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("created_at") @JsonAlias("timestamp") String timestamp,
        @JsonProperty("charge_counter_uah") @JsonAlias("charge_counter") Double chargeCounterUah,
        @JsonProperty("current_avg_ua") Double currentAvgUa,
        @JsonProperty("battery_level") Integer batteryLevel,
        @JsonProperty("batt_voltage_mv") Double battVoltageMv,
        @JsonProperty("batt_temp_c") Double battTempC,
        @JsonProperty("tx_total_bytes") Long txTotalBytes,
        @JsonProperty("rx_total_bytes") Long rxTotalBytes,
        @JsonProperty("fg_pkg") String foregroundPackage
) {
}
