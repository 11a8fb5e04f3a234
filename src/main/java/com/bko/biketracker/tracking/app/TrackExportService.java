package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.ActivityNotFoundException;
import com.bko.biketracker.tracking.ExportTrackUseCase;
import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityStore;
import com.bko.biketracker.tracking.domain.GpxTrackExporter;
import com.bko.biketracker.tracking.domain.ProbeStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TrackExportService implements ExportTrackUseCase {
    private final ActivityStore activityStore;
    private final ProbeStore probeStore;
    private final GpxTrackExporter exporter;

    public TrackExportService(ActivityStore activityStore, ProbeStore probeStore, GpxTrackExporter exporter) {
        this.activityStore = activityStore;
        this.probeStore = probeStore;
        this.exporter = exporter;
    }

    @Override
    @Transactional(readOnly = true)
    public byte[] exportGpx(long activityId) {
        Activity activity = activityStore.findById(activityId)
                .orElseThrow(() -> new ActivityNotFoundException(activityId));
        return exporter.export(activity, probeStore.findByActivity(activityId));
    }
}
