package com.bko.biketracker.tracking.domain;

public final class ProbeReadings {
    private ProbeReadings() {
    }

    public static ProbeReading moving(int sequence, double distance) {
        return new ProbeReading(sequence, 50.5, 5.5, 120.0, distance, 2.0, 5.0, null, null);
    }

    public static ProbeReading idle(int sequence) {
        return new ProbeReading(sequence, 50.5, 5.5, 120.0, 0.0, 0.0, 0.0, null, null);
    }
}
