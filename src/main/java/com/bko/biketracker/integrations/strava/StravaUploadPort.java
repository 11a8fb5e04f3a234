package com.bko.biketracker.integrations.strava;

import java.io.IOException;

public interface StravaUploadPort {
    /**
     * @return the id of the created Strava activity
     */
    String createActivity(StravaActivityDraft draft) throws IOException;

    /**
     * Uploads a GPX file. Strava processes uploads asynchronously.
     *
     * @return the activity id when Strava already created it, otherwise {@code upload/<upload id>}
     */
    String uploadTrack(StravaTrackUpload upload) throws IOException;
}
