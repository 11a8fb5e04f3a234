package com.bko.biketracker.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);

    @Bean
    public AppSettings appSettings(Environment environment, EnvConfig envConfig) {
        SettingsSource source = key -> firstNonEmpty(environment.getProperty(key), envConfig.get(key));
        return load(source);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static AppSettings load(SettingsSource source) {
        UnitScales defaults = UnitScales.FIRMWARE_DEFAULTS;
        UnitScales units = new UnitScales(
                parseDouble(source, "tracker.units.distance-factor", defaults.distanceFactor()),
                parseDouble(source, "tracker.units.altitude-gain-factor", defaults.altitudeGainFactor()),
                parseDouble(source, "tracker.units.speed-divisor", defaults.speedDivisor()),
                parseDouble(source, "tracker.units.moving-time-factor", defaults.movingTimeFactor())
        );
        TrackerSettings tracker = new TrackerSettings(
                source.get("tracker.device-id"),
                parseThreshold(source.get("tracker.inactivity-threshold")),
                parseZone(source.get("tracker.timezone")),
                parsePositiveInt(source, "tracker.dashboard-probes", 50),
                MotionField.parse(source.get("tracker.motion-field")),
                units
        );
        StravaSettings strava = new StravaSettings(
                source.get("strava.client-id"),
                source.get("strava.client-secret"),
                source.get("strava.refresh-token"),
                firstNonEmpty(source.get("strava.sport-type"), "Ride"),
                Boolean.parseBoolean(source.get("strava.upload-track"))
        );
        if (!tracker.isConfigured()) {
            logger.warn("TRACKER_DEVICE_ID is not set, every probe report will be rejected.");
        }
        return new AppSettings(tracker, strava);
    }

    /**
     * Accepts an ISO-8601 duration ({@code PT1H}) or a plain number of minutes.
     */
    static Duration parseThreshold(String value) {
        if (value == null || value.isBlank()) {
            return TrackerSettings.DEFAULT_INACTIVITY_THRESHOLD;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit)) {
                return Duration.ofMinutes(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid inactivity threshold: " + value, e);
        }
    }

    private static ZoneId parseZone(String value) {
        return value == null || value.isBlank() ? ZoneId.of("UTC") : ZoneId.of(value.trim());
    }

    private static int parsePositiveInt(SettingsSource source, String key, int defaultValue) {
        String value = source.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return parsed;
    }

    private static double parseDouble(SettingsSource source, String key, double defaultValue) {
        String value = source.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static String firstNonEmpty(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    @FunctionalInterface
    interface SettingsSource {
        String get(String key);
    }
}
