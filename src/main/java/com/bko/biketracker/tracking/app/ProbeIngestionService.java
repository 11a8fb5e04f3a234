package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.IngestProbeUseCase;
import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.Probe;
import com.bko.biketracker.tracking.domain.ProbeReading;
import com.bko.biketracker.tracking.domain.ProbeStore;
import com.bko.biketracker.tracking.domain.RawProbeReport;
import com.bko.biketracker.tracking.domain.SegmentationEngine;
import com.bko.biketracker.tracking.domain.UnitNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class ProbeIngestionService implements IngestProbeUseCase {
    private static final Logger logger = LoggerFactory.getLogger(ProbeIngestionService.class);

    private final UnitNormalizer unitNormalizer;
    private final ProbeStore probeStore;
    private final SegmentationEngine segmentationEngine;
    private final SerializedWriter writer;
    private final Clock clock;

    public ProbeIngestionService(UnitNormalizer unitNormalizer,
                                 ProbeStore probeStore,
                                 SegmentationEngine segmentationEngine,
                                 SerializedWriter writer,
                                 Clock clock) {
        this.unitNormalizer = unitNormalizer;
        this.probeStore = probeStore;
        this.segmentationEngine = segmentationEngine;
        this.writer = writer;
        this.clock = clock;
    }

    @Override
    public IngestionResult ingest(RawProbeReport report) {
        ProbeReading reading = unitNormalizer.normalize(report);
        return writer.write(() -> store(reading));
    }

    private IngestionResult store(ProbeReading reading) {
        // The radio network may deliver the same message twice.
        Optional<Probe> previous = probeStore.findLast();
        if (previous.isPresent() && previous.get().sequence() == reading.sequence()) {
            logger.warn("Sequence {} already stored as probe {}, ignoring retransmission",
                    reading.sequence(), previous.get().id());
            return IngestionResult.duplicate(previous.get());
        }

        Probe probe = probeStore.insert(reading, clock.instant());
        Optional<Activity> activity = segmentationEngine.assign(probe);
        logger.info("Stored probe {} (seq {}, {} m){}", probe.id(), probe.sequence(), probe.distance(),
                activity.map(a -> " in activity " + a.id()).orElse(", idle"));
        return IngestionResult.stored(probe, activity.map(Activity::id).orElse(null));
    }
}
