package com.bko.biketracker.tracking.app;

import com.bko.biketracker.shared.AppSettings;
import com.bko.biketracker.tracking.domain.ActivityAggregator;
import com.bko.biketracker.tracking.domain.ActivityStore;
import com.bko.biketracker.tracking.domain.GpxTrackExporter;
import com.bko.biketracker.tracking.domain.ProbeStore;
import com.bko.biketracker.tracking.domain.SegmentationEngine;
import com.bko.biketracker.tracking.domain.UnitNormalizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TrackingConfiguration {

    @Bean
    public UnitNormalizer unitNormalizer(AppSettings settings) {
        return new UnitNormalizer(settings.tracker().units());
    }

    @Bean
    public SegmentationEngine segmentationEngine(ProbeStore probeStore, ActivityStore activityStore, AppSettings settings) {
        return new SegmentationEngine(probeStore, activityStore, settings.tracker().inactivityThreshold());
    }

    @Bean
    public ActivityAggregator activityAggregator(AppSettings settings) {
        return new ActivityAggregator(settings.tracker().zoneId());
    }

    @Bean
    public GpxTrackExporter gpxTrackExporter() {
        return new GpxTrackExporter();
    }
}
