package com.bko.biketracker.tracking.domain;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Statistics derived from the members of an activity.
 *
 * @param maxSpeed     fastest reported speed in m/s, {@code null} when no member reports speed
 * @param movingTime   total moving time, {@code null} when no member reports it
 * @param averageSpeed meters per second over the moving time when known, otherwise over the duration
 */
public record ActivityStats(
        ZonedDateTime start,
        ZonedDateTime end,
        Duration duration,
        double totalDistance,
        double totalAltitudeGain,
        Double maxSpeed,
        Duration movingTime,
        Double averageSpeed,
        int probeCount
) {
    public double totalDistanceKm() {
        return totalDistance / 1000.0;
    }
}
