package com.bko.biketracker.tracking;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ActivityNotFoundException extends RuntimeException {
    private final long activityId;

    public ActivityNotFoundException(long activityId) {
        super("Activity " + activityId + " not found");
        this.activityId = activityId;
    }

    public long getActivityId() {
        return activityId;
    }
}
