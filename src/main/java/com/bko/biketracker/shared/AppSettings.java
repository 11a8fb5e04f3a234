package com.bko.biketracker.shared;

public record AppSettings(TrackerSettings tracker, StravaSettings strava) {
    public boolean isDeviceConfigured() {
        return tracker != null && tracker.isConfigured();
    }

    public boolean isStravaConfigured() {
        return strava != null && strava.isConfigured();
    }
}
