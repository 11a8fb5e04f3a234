package com.bko.biketracker.tracking;

import com.bko.biketracker.tracking.app.ActivityDetail;

public interface MergeActivitiesUseCase {
    /**
     * Moves every probe of {@code sourceId} into {@code targetId} and deletes the source activity.
     *
     * @throws ActivityNotFoundException if either activity does not exist
     */
    ActivityDetail merge(long sourceId, long targetId);
}
