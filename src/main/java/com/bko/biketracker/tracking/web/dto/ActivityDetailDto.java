package com.bko.biketracker.tracking.web.dto;

import com.bko.biketracker.tracking.app.ActivityDetail;
import com.bko.biketracker.tracking.domain.ActivityStats;

import java.util.List;

public record ActivityDetailDto(
        long id,
        String externalReference,
        String start,
        String end,
        long durationSeconds,
        double totalDistance,
        double totalAltitudeGain,
        Double maxSpeed,
        Long movingTimeSeconds,
        Double averageSpeed,
        int probeCount,
        List<ProbeDto> probes
) {
    public static ActivityDetailDto from(ActivityDetail detail) {
        ActivityStats stats = detail.stats();
        return new ActivityDetailDto(
                detail.activity().id(),
                detail.activity().externalReference(),
                stats.start().toOffsetDateTime().toString(),
                stats.end().toOffsetDateTime().toString(),
                stats.duration().getSeconds(),
                stats.totalDistance(),
                stats.totalAltitudeGain(),
                stats.maxSpeed(),
                stats.movingTime() == null ? null : stats.movingTime().getSeconds(),
                stats.averageSpeed(),
                stats.probeCount(),
                detail.probes().stream().map(ProbeDto::from).toList()
        );
    }
}
