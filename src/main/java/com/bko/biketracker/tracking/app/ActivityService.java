package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.ActivityDetailUseCase;
import com.bko.biketracker.tracking.ActivityNotFoundException;
import com.bko.biketracker.tracking.MergeActivitiesUseCase;
import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityAggregator;
import com.bko.biketracker.tracking.domain.ActivityStats;
import com.bko.biketracker.tracking.domain.ActivityStore;
import com.bko.biketracker.tracking.domain.Probe;
import com.bko.biketracker.tracking.domain.ProbeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ActivityService implements ActivityDetailUseCase, MergeActivitiesUseCase {
    private static final Logger logger = LoggerFactory.getLogger(ActivityService.class);

    private final ActivityStore activityStore;
    private final ProbeStore probeStore;
    private final ActivityAggregator aggregator;
    private final SerializedWriter writer;

    public ActivityService(ActivityStore activityStore,
                           ProbeStore probeStore,
                           ActivityAggregator aggregator,
                           SerializedWriter writer) {
        this.activityStore = activityStore;
        this.probeStore = probeStore;
        this.aggregator = aggregator;
        this.writer = writer;
    }

    @Override
    @Transactional(readOnly = true)
    public ActivityDetail loadActivity(long activityId) {
        Activity activity = activityStore.findById(activityId)
                .orElseThrow(() -> new ActivityNotFoundException(activityId));
        return detail(activity);
    }

    @Override
    public ActivityDetail merge(long sourceId, long targetId) {
        return writer.write(() -> {
            activityStore.findById(sourceId).orElseThrow(() -> new ActivityNotFoundException(sourceId));
            Activity target = activityStore.findById(targetId)
                    .orElseThrow(() -> new ActivityNotFoundException(targetId));
            if (sourceId == targetId) {
                throw new IllegalArgumentException("Cannot merge activity " + sourceId + " into itself");
            }

            int moved = probeStore.reassignActivity(sourceId, targetId);
            activityStore.delete(sourceId);
            logger.info("Merged activity {} into {} ({} probes moved)", sourceId, targetId, moved);
            return detail(target);
        });
    }

    ActivityDetail detail(Activity activity) {
        List<Probe> probes = probeStore.findByActivity(activity.id());
        ActivityStats stats = aggregator.aggregate(probes)
                .orElseThrow(() -> new IllegalStateException("Activity " + activity.id() + " has no probes"));
        return new ActivityDetail(activity, probes, stats);
    }
}
