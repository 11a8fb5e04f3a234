package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.domain.Probe;

import java.util.List;

/**
 * @param latestProbes most recently received probes, newest first, regardless of activity
 * @param activities   most recent activities, newest first
 */
public record DashboardSnapshot(List<Probe> latestProbes, List<ActivitySummary> activities) {
}
