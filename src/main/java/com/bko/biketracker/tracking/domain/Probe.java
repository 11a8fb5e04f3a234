package com.bko.biketracker.tracking.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * A stored telemetry report. Only {@code activityId} changes after insertion, through the store.
 *
 * @param id         storage-assigned identity, the canonical ordering key
 * @param sequence   sequence number reported by the device, never used for ordering
 * @param receivedAt receipt time, monotonic with {@code id}
 * @param activityId owning activity, {@code null} while unassigned
 */
public record Probe(
        long id,
        int sequence,
        Instant receivedAt,
        double latitude,
        double longitude,
        Double altitude,
        double distance,
        double altitudeGain,
        Double maxSpeed,
        Duration movingTime,
        Duration reportInterval,
        Long activityId
) {
    /**
     * A probe is idle when the device did not travel since its previous report.
     */
    public boolean isIdle() {
        return distance == 0.0;
    }

    public boolean isAssigned() {
        return activityId != null;
    }
}
