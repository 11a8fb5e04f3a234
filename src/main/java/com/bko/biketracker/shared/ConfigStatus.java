package com.bko.biketracker.shared;

public record ConfigStatus(boolean deviceConfigured, boolean stravaConfigured) {
    public static ConfigStatus from(AppSettings settings) {
        return new ConfigStatus(
                settings.isDeviceConfigured(),
                settings.isStravaConfigured()
        );
    }
}
