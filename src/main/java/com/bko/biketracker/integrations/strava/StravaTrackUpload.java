package com.bko.biketracker.integrations.strava;

/**
 * @param externalId identifier echoed back by Strava, used to spot double uploads
 */
public record StravaTrackUpload(String name, String sportType, String description, String externalId, byte[] gpx) {
}
