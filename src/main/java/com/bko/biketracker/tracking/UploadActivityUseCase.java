package com.bko.biketracker.tracking;

import com.bko.biketracker.tracking.app.UploadReport;

public interface UploadActivityUseCase {
    UploadReport uploadToStrava(long activityId);
}
