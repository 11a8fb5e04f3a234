package com.bko.biketracker.shared;

/**
 * Strava API credentials and upload options.
 *
 * @param sportType   Strava sport type given to created activities, e.g. {@code Ride}
 * @param uploadTrack when set, activities are uploaded as GPX files instead of manual entries
 */
public record StravaSettings(
        String clientId,
        String clientSecret,
        String refreshToken,
        String sportType,
        boolean uploadTrack
) {
    public boolean isConfigured() {
        return hasText(clientId) && hasText(clientSecret) && hasText(refreshToken);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
