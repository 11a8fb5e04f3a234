package com.bko.biketracker.shared;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings of the tracked device and of the activity segmentation.
 *
 * @param deviceId            identifier the device must present on every report
 * @param inactivityThreshold largest gap between two moving probes of the same activity (exclusive)
 * @param zoneId              zone used to display local activity times
 * @param dashboardProbes     number of probes listed on the dashboard
 */
public record TrackerSettings(
        String deviceId,
        Duration inactivityThreshold,
        ZoneId zoneId,
        int dashboardProbes,
        MotionField motionField,
        UnitScales units
) {
    public static final Duration DEFAULT_INACTIVITY_THRESHOLD = Duration.ofMinutes(20);

    public boolean isConfigured() {
        return deviceId != null && !deviceId.isBlank();
    }
}
