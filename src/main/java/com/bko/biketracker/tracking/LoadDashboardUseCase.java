package com.bko.biketracker.tracking;

import com.bko.biketracker.tracking.app.DashboardSnapshot;
import com.bko.biketracker.tracking.domain.Probe;

import java.time.Instant;
import java.util.List;

public interface LoadDashboardUseCase {
    DashboardSnapshot loadDashboard();

    List<Probe> probesReceivedBetween(Instant from, Instant to);
}
