package com.bko.biketracker.tracking;

import com.bko.biketracker.tracking.app.IngestionResult;
import com.bko.biketracker.tracking.domain.RawProbeReport;

public interface IngestProbeUseCase {
    IngestionResult ingest(RawProbeReport report);
}
