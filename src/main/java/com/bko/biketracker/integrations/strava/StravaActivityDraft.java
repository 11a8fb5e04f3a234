package com.bko.biketracker.integrations.strava;

import java.time.LocalDateTime;

/**
 * A manual Strava entry.
 *
 * @param elapsedSeconds whole seconds between the first and last probe
 * @param distance       meters
 */
public record StravaActivityDraft(
        String name,
        String sportType,
        LocalDateTime startDateLocal,
        long elapsedSeconds,
        double distance,
        String description
) {
}
