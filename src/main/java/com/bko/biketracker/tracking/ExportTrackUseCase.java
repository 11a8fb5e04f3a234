package com.bko.biketracker.tracking;

public interface ExportTrackUseCase {
    /**
     * @return the activity as a GPX document
     * @throws ActivityNotFoundException if no activity has this id
     */
    byte[] exportGpx(long activityId);
}
