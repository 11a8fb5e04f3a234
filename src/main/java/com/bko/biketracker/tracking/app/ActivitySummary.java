package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityStats;

public record ActivitySummary(Activity activity, ActivityStats stats) {
}
