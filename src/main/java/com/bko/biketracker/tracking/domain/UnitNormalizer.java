package com.bko.biketracker.tracking.domain;

import com.bko.biketracker.shared.MotionField;
import com.bko.biketracker.shared.UnitScales;

import java.time.Duration;

/**
 * Converts the device's scaled integers into meters, meters per second and durations.
 */
public class UnitNormalizer {
    private static final double KPH_TO_MPS = 1000.0 / 3600.0;

    private final UnitScales scales;

    public UnitNormalizer(UnitScales scales) {
        this.scales = scales;
    }

    public ProbeReading normalize(RawProbeReport report) {
        Double maxSpeed = null;
        Duration movingTime = null;
        if (report.motionField() == MotionField.MOVING_TIME) {
            movingTime = seconds(report.motion() * scales.movingTimeFactor());
        } else {
            maxSpeed = report.motion() / scales.speedDivisor() * KPH_TO_MPS;
        }

        // The firmware sends the square root of the elapsed seconds.
        Duration reportInterval = null;
        if (report.lastReport() != null) {
            long root = report.lastReport();
            reportInterval = Duration.ofSeconds(root * root);
        }

        return new ProbeReading(
                report.sequence(),
                report.latitude(),
                report.longitude(),
                report.altitude(),
                report.distance() * scales.distanceFactor(),
                report.altitudeGain() * scales.altitudeGainFactor(),
                maxSpeed,
                movingTime,
                reportInterval
        );
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000.0));
    }
}
