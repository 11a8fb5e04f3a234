package com.bko.biketracker.tracking.web.dto;

import com.bko.biketracker.tracking.domain.Probe;

import java.time.Instant;

public record ProbeDto(
        long id,
        int sequence,
        Instant receivedAt,
        double latitude,
        double longitude,
        Double altitude,
        double distance,
        double altitudeGain,
        Double maxSpeed,
        Long movingTimeSeconds,
        Long reportIntervalSeconds,
        Long activityId
) {
    public static ProbeDto from(Probe probe) {
        return new ProbeDto(
                probe.id(),
                probe.sequence(),
                probe.receivedAt(),
                probe.latitude(),
                probe.longitude(),
                probe.altitude(),
                probe.distance(),
                probe.altitudeGain(),
                probe.maxSpeed(),
                probe.movingTime() == null ? null : probe.movingTime().getSeconds(),
                probe.reportInterval() == null ? null : probe.reportInterval().getSeconds(),
                probe.activityId()
        );
    }
}
