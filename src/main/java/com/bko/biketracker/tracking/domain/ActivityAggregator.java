package com.bko.biketracker.tracking.domain;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

public class ActivityAggregator {
    private final ZoneId zoneId;

    public ActivityAggregator(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    /**
     * Folds the probes of an activity, given in identity order.
     *
     * @return empty when there are no probes
     */
    public Optional<ActivityStats> aggregate(List<Probe> probes) {
        if (probes.isEmpty()) {
            return Optional.empty();
        }

        double distance = 0.0;
        double altitudeGain = 0.0;
        Double maxSpeed = null;
        Duration movingTime = null;
        for (Probe probe : probes) {
            distance += probe.distance();
            altitudeGain += probe.altitudeGain();
            if (probe.maxSpeed() != null) {
                maxSpeed = maxSpeed == null ? probe.maxSpeed() : Math.max(maxSpeed, probe.maxSpeed());
            }
            if (probe.movingTime() != null) {
                movingTime = movingTime == null ? probe.movingTime() : movingTime.plus(probe.movingTime());
            }
        }

        ZonedDateTime start = probes.get(0).receivedAt().atZone(zoneId);
        ZonedDateTime end = probes.get(probes.size() - 1).receivedAt().atZone(zoneId);
        Duration duration = Duration.between(start, end);

        return Optional.of(new ActivityStats(
                start,
                end,
                duration,
                distance,
                altitudeGain,
                maxSpeed,
                movingTime,
                averageSpeed(distance, movingTime != null ? movingTime : duration),
                probes.size()
        ));
    }

    private static Double averageSpeed(double distance, Duration elapsed) {
        if (elapsed.isZero() || elapsed.isNegative()) {
            return null;
        }
        return distance / (elapsed.toMillis() / 1000.0);
    }
}
