package com.bko.biketracker.tracking.web;

import com.bko.biketracker.shared.AppSettings;
import com.bko.biketracker.shared.MotionField;
import com.bko.biketracker.tracking.domain.RawProbeReport;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Validates the form posted by the radio network callback and decodes it into a {@link RawProbeReport}.
 * Fields: {@code device}, {@code seq}, {@code lat}, {@code lng}, {@code alt} (optional), {@code dist},
 * {@code alt_gain}, {@code max_speed} or {@code moving_time} depending on the firmware,
 * {@code last_msg} (optional).
 */
@Component
public class ProbeFormParser {
    private final AppSettings settings;

    public ProbeFormParser(AppSettings settings) {
        this.settings = settings;
    }

    public RawProbeReport parse(Map<String, String> form) {
        String device = required(form, "device");
        if (!settings.isDeviceConfigured() || !device.equals(settings.tracker().deviceId())) {
            throw new InvalidProbeReportException("Invalid device ID.");
        }

        MotionField motionField = settings.tracker().motionField();
        double latitude = requiredDouble(form, "lat");
        double longitude = requiredDouble(form, "lng");
        if (latitude < -90.0 || latitude > 90.0) {
            throw new InvalidProbeReportException("Latitude out of range: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new InvalidProbeReportException("Longitude out of range: " + longitude);
        }

        return new RawProbeReport(
                requiredInt(form, "seq"),
                latitude,
                longitude,
                optionalDouble(form, "alt"),
                requiredCount(form, "dist"),
                requiredCount(form, "alt_gain"),
                motionField,
                requiredCount(form, motionField.formField()),
                optionalCount(form, "last_msg")
        );
    }

    private static String required(Map<String, String> form, String field) {
        String value = form.get(field);
        if (value == null || value.isBlank()) {
            throw new InvalidProbeReportException("Missing field '" + field + "'");
        }
        return value.trim();
    }

    private static int requiredInt(Map<String, String> form, String field) {
        return toInt(field, required(form, field));
    }

    private static int requiredCount(Map<String, String> form, String field) {
        int value = requiredInt(form, field);
        if (value < 0) {
            throw new InvalidProbeReportException("Field '" + field + "' must not be negative");
        }
        return value;
    }

    private static Integer optionalCount(Map<String, String> form, String field) {
        String value = form.get(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        return requiredCount(form, field);
    }

    private static double requiredDouble(Map<String, String> form, String field) {
        return toDouble(field, required(form, field));
    }

    private static Double optionalDouble(Map<String, String> form, String field) {
        String value = form.get(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        return toDouble(field, value.trim());
    }

    private static int toInt(String field, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidProbeReportException("Field '" + field + "' is not an integer: " + value);
        }
    }

    private static double toDouble(String field, String value) {
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidProbeReportException("Field '" + field + "' is not a number: " + value);
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new InvalidProbeReportException("Field '" + field + "' is not a finite number: " + value);
        }
        return parsed;
    }
}
