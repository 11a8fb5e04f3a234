package com.bko.biketracker.tracking.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides, for each newly stored probe, whether it extends the latest activity or starts a new one.
 * <p>
 * Moving probes received less than {@code inactivityThreshold} after the last member of the latest
 * activity join it, together with every probe stored in between (the idle probes the device sent
 * while paused). Otherwise a new activity is created and the previous one is never touched again.
 * Idle probes never create or extend an activity on their own.
 * <p>
 * Not thread-safe and not idempotent: each stored probe must be assigned exactly once, by a single
 * writer, in the transaction that inserted it.
 */
public class SegmentationEngine {
    private static final Logger logger = LoggerFactory.getLogger(SegmentationEngine.class);

    private final ProbeStore probeStore;
    private final ActivityStore activityStore;
    private final Duration inactivityThreshold;

    public SegmentationEngine(ProbeStore probeStore, ActivityStore activityStore, Duration inactivityThreshold) {
        if (inactivityThreshold.isNegative() || inactivityThreshold.isZero()) {
            throw new IllegalArgumentException("Inactivity threshold must be positive: " + inactivityThreshold);
        }
        this.probeStore = probeStore;
        this.activityStore = activityStore;
        this.inactivityThreshold = inactivityThreshold;
    }

    public Optional<Activity> assign(Probe probe) {
        if (probe.isIdle()) {
            return Optional.empty();
        }

        Optional<Activity> latest = activityStore.findLatest();
        if (latest.isPresent()) {
            Activity activity = latest.get();
            Probe last = probeStore.findLastOfActivity(activity.id())
                    .orElseThrow(() -> new IllegalStateException("Activity " + activity.id() + " has no probes"));
            Duration gap = Duration.between(last.receivedAt(), probe.receivedAt());
            if (gap.compareTo(inactivityThreshold) < 0) {
                List<Long> joining = new ArrayList<>();
                for (Probe skipped : probeStore.findBetween(last.id(), probe.id())) {
                    joining.add(skipped.id());
                }
                joining.add(probe.id());
                probeStore.assignActivity(joining, activity.id());
                logger.info("Probe {} extends activity {} ({} backfilled, gap {})",
                        probe.id(), activity.id(), joining.size() - 1, gap);
                return Optional.of(activity);
            }
        }

        Activity created = activityStore.create();
        probeStore.assignActivity(List.of(probe.id()), created.id());
        logger.info("Probe {} starts activity {}", probe.id(), created.id());
        return Optional.of(created);
    }

    public Duration inactivityThreshold() {
        return inactivityThreshold;
    }
}
