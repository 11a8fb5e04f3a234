package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityStats;
import com.bko.biketracker.tracking.domain.Probe;

import java.util.List;

public record ActivityDetail(Activity activity, List<Probe> probes, ActivityStats stats) {
}
