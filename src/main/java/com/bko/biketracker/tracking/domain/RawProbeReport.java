package com.bko.biketracker.tracking.domain;

import com.bko.biketracker.shared.MotionField;

/**
 * A report as encoded by the device: scaled integers for the deltas.
 *
 * @param motion     encoded max speed or moving time, see {@code motionField}
 * @param lastReport square root of the seconds since the previous transmitted report, if sent
 */
public record RawProbeReport(
        int sequence,
        double latitude,
        double longitude,
        Double altitude,
        int distance,
        int altitudeGain,
        MotionField motionField,
        int motion,
        Integer lastReport
) {
}
