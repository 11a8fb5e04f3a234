package com.bko.biketracker.shared;

/**
 * Scale factors from the device's integer encoding to physical units.
 *
 * @param distanceFactor     meters per encoded distance unit
 * @param altitudeGainFactor meters per encoded altitude gain unit
 * @param speedDivisor       encoded speed divided by this value gives km/h
 * @param movingTimeFactor   seconds per encoded moving time unit
 */
public record UnitScales(
        double distanceFactor,
        double altitudeGainFactor,
        double speedDivisor,
        double movingTimeFactor
) {
    public static final UnitScales FIRMWARE_DEFAULTS = new UnitScales(16.0, 2.0, 3.0, 1.0);

    public UnitScales {
        if (speedDivisor == 0.0) {
            throw new IllegalArgumentException("Speed divisor must not be zero");
        }
    }
}
