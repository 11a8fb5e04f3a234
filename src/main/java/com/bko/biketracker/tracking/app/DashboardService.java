package com.bko.biketracker.tracking.app;

import com.bko.biketracker.shared.AppSettings;
import com.bko.biketracker.tracking.LoadDashboardUseCase;
import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityAggregator;
import com.bko.biketracker.tracking.domain.ActivityStore;
import com.bko.biketracker.tracking.domain.Probe;
import com.bko.biketracker.tracking.domain.ProbeStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class DashboardService implements LoadDashboardUseCase {
    private static final int RECENT_ACTIVITIES = 20;

    private final ProbeStore probeStore;
    private final ActivityStore activityStore;
    private final ActivityAggregator aggregator;
    private final AppSettings settings;

    public DashboardService(ProbeStore probeStore,
                            ActivityStore activityStore,
                            ActivityAggregator aggregator,
                            AppSettings settings) {
        this.probeStore = probeStore;
        this.activityStore = activityStore;
        this.aggregator = aggregator;
        this.settings = settings;
    }

    @Override
    @Transactional(readOnly = true)
    public DashboardSnapshot loadDashboard() {
        List<Probe> latest = probeStore.findLatest(settings.tracker().dashboardProbes());

        List<ActivitySummary> activities = new ArrayList<>();
        for (Activity activity : activityStore.findRecent(RECENT_ACTIVITIES)) {
            aggregator.aggregate(probeStore.findByActivity(activity.id()))
                    .ifPresent(stats -> activities.add(new ActivitySummary(activity, stats)));
        }
        return new DashboardSnapshot(latest, activities);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Probe> probesReceivedBetween(Instant from, Instant to) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        return probeStore.findReceivedBetween(from, to);
    }
}
