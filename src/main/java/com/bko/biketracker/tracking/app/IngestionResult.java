package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.domain.Probe;

/**
 * Outcome of one report.
 *
 * @param activityId activity the probe joined, {@code null} for an idle probe
 * @param duplicate  the report repeated the last stored sequence number and was not stored again
 */
public record IngestionResult(Probe probe, Long activityId, boolean duplicate) {

    public static IngestionResult stored(Probe probe, Long activityId) {
        return new IngestionResult(probe, activityId, false);
    }

    public static IngestionResult duplicate(Probe probe) {
        return new IngestionResult(probe, probe.activityId(), true);
    }

    /**
     * Eight-byte acknowledgment returned to the device network, as 16 hex digits.
     */
    public String downlinkToken() {
        return String.format("%016x", probe.id());
    }
}
