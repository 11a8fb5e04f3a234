package com.bko.biketracker.tracking.domain;

import java.time.Instant;

/**
 * A ride. Member probes reference the activity; they are read through {@link ProbeStore#findByActivity(long)}.
 *
 * @param externalReference reference of the uploaded Strava entry, {@code null} until uploaded
 */
public record Activity(long id, Instant createdAt, String externalReference) {
    public boolean isUploaded() {
        return externalReference != null;
    }
}
