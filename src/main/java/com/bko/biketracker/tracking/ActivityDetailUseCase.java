package com.bko.biketracker.tracking;

import com.bko.biketracker.tracking.app.ActivityDetail;

public interface ActivityDetailUseCase {
    /**
     * @throws ActivityNotFoundException if no activity has this id
     */
    ActivityDetail loadActivity(long activityId);
}
