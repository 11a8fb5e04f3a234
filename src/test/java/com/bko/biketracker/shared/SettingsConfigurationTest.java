package com.bko.biketracker.shared;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsConfigurationTest {

    @Test
    void emptySourceYieldsDefaults() {
        AppSettings settings = SettingsConfiguration.load(key -> null);

        assertFalse(settings.isDeviceConfigured());
        assertFalse(settings.isStravaConfigured());
        assertEquals(Duration.ofMinutes(20), settings.tracker().inactivityThreshold());
        assertEquals(ZoneId.of("UTC"), settings.tracker().zoneId());
        assertEquals(50, settings.tracker().dashboardProbes());
        assertEquals(MotionField.MAX_SPEED, settings.tracker().motionField());
        assertEquals(UnitScales.FIRMWARE_DEFAULTS, settings.tracker().units());
        assertEquals("Ride", settings.strava().sportType());
        assertFalse(settings.strava().uploadTrack());
    }

    @Test
    void readsEveryKey() {
        Map<String, String> values = new HashMap<>();
        values.put("tracker.device-id", "ABC123");
        values.put("tracker.inactivity-threshold", "PT45M");
        values.put("tracker.timezone", "Europe/Brussels");
        values.put("tracker.dashboard-probes", "25");
        values.put("tracker.motion-field", "moving_time");
        values.put("tracker.units.distance-factor", "10");
        values.put("strava.client-id", "id");
        values.put("strava.client-secret", "secret");
        values.put("strava.refresh-token", "refresh");
        values.put("strava.sport-type", "EBikeRide");
        values.put("strava.upload-track", "true");

        AppSettings settings = SettingsConfiguration.load(values::get);

        assertTrue(settings.isDeviceConfigured());
        assertTrue(settings.isStravaConfigured());
        assertEquals("ABC123", settings.tracker().deviceId());
        assertEquals(Duration.ofMinutes(45), settings.tracker().inactivityThreshold());
        assertEquals(ZoneId.of("Europe/Brussels"), settings.tracker().zoneId());
        assertEquals(25, settings.tracker().dashboardProbes());
        assertEquals(MotionField.MOVING_TIME, settings.tracker().motionField());
        assertEquals(10.0, settings.tracker().units().distanceFactor());
        assertEquals(3.0, settings.tracker().units().speedDivisor());
        assertEquals("EBikeRide", settings.strava().sportType());
        assertTrue(settings.strava().uploadTrack());
    }

    @Test
    void thresholdAcceptsMinutesOrIsoDuration() {
        assertEquals(Duration.ofMinutes(30), SettingsConfiguration.parseThreshold("30"));
        assertEquals(Duration.ofMinutes(90), SettingsConfiguration.parseThreshold(" PT1H30M "));
        assertEquals(Duration.ofMinutes(20), SettingsConfiguration.parseThreshold(""));
        assertThrows(IllegalArgumentException.class, () -> SettingsConfiguration.parseThreshold("soon"));
    }

    @Test
    void invalidNumberIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SettingsConfiguration.load(key -> key.equals("tracker.units.speed-divisor") ? "fast" : null));
        assertThrows(IllegalArgumentException.class,
                () -> SettingsConfiguration.load(key -> key.equals("tracker.units.speed-divisor") ? "0" : null));
    }

    @Test
    void dashboardProbeCountMustBePositiveInteger() {
        for (String invalid : new String[]{"0", "-5", "2.5", "many"}) {
            assertThrows(IllegalArgumentException.class,
                    () -> SettingsConfiguration.load(key -> key.equals("tracker.dashboard-probes") ? invalid : null),
                    invalid);
        }
        assertEquals(7, SettingsConfiguration.load(key -> key.equals("tracker.dashboard-probes") ? " 7 " : null)
                .tracker().dashboardProbes());
    }

    @Test
    void envKeysAreUpperCasedWithUnderscores() {
        assertEquals("TRACKER_DEVICE_ID", EnvConfig.toEnvKey("tracker.device-id"));
        assertEquals("STRAVA_UPLOAD_TRACK", EnvConfig.toEnvKey("strava.upload-track"));
    }
}
