package com.bko.biketracker.shared;

/**
 * Movement intensity signal sent by the device. Older firmware reports the maximum speed of the
 * interval, newer firmware the time spent moving.
 */
public enum MotionField {
    MAX_SPEED("max_speed"),
    MOVING_TIME("moving_time");

    private final String formField;

    MotionField(String formField) {
        this.formField = formField;
    }

    public String formField() {
        return formField;
    }

    public static MotionField parse(String value) {
        if (value == null || value.isBlank()) {
            return MAX_SPEED;
        }
        String normalized = value.trim().toLowerCase().replace('-', '_');
        for (MotionField field : values()) {
            if (field.formField.equals(normalized) || field.name().equalsIgnoreCase(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown motion field: " + value);
    }
}
