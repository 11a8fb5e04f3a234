package com.bko.biketracker.tracking.domain;

import java.time.Duration;

/**
 * A report converted to physical units, not yet stored.
 * Exactly one of {@code maxSpeed} (m/s) and {@code movingTime} is set, depending on the firmware generation.
 */
public record ProbeReading(
        int sequence,
        double latitude,
        double longitude,
        Double altitude,
        double distance,
        double altitudeGain,
        Double maxSpeed,
        Duration movingTime,
        Duration reportInterval
) {
}
