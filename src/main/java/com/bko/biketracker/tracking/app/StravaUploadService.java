package com.bko.biketracker.tracking.app;

import com.bko.biketracker.integrations.strava.StravaActivityDraft;
import com.bko.biketracker.integrations.strava.StravaTrackUpload;
import com.bko.biketracker.integrations.strava.StravaUploadPort;
import com.bko.biketracker.shared.AppSettings;
import com.bko.biketracker.tracking.ActivityDetailUseCase;
import com.bko.biketracker.tracking.UploadActivityUseCase;
import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityStats;
import com.bko.biketracker.tracking.domain.ActivityStore;
import com.bko.biketracker.tracking.domain.GpxTrackExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pushes an activity to Strava once. The reference is stored only after Strava confirmed it,
 * so a failed upload can simply be retried. Uploads run one at a time and re-read the activity
 * under the lock, so a second request for the same activity sees the stored reference.
 */
@Service
public class StravaUploadService implements UploadActivityUseCase {
    private static final Logger logger = LoggerFactory.getLogger(StravaUploadService.class);

    private final ActivityDetailUseCase activityDetailUseCase;
    private final ActivityStore activityStore;
    private final GpxTrackExporter exporter;
    private final StravaUploadPort stravaUploadPort;
    private final SerializedWriter writer;
    private final AppSettings settings;
    private final ReentrantLock uploadLock = new ReentrantLock();

    public StravaUploadService(ActivityDetailUseCase activityDetailUseCase,
                               ActivityStore activityStore,
                               GpxTrackExporter exporter,
                               StravaUploadPort stravaUploadPort,
                               SerializedWriter writer,
                               AppSettings settings) {
        this.activityDetailUseCase = activityDetailUseCase;
        this.activityStore = activityStore;
        this.exporter = exporter;
        this.stravaUploadPort = stravaUploadPort;
        this.writer = writer;
        this.settings = settings;
    }

    @Override
    public UploadReport uploadToStrava(long activityId) {
        uploadLock.lock();
        try {
            return upload(activityId);
        } finally {
            uploadLock.unlock();
        }
    }

    private UploadReport upload(long activityId) {
        ActivityDetail detail = activityDetailUseCase.loadActivity(activityId);
        Activity activity = detail.activity();

        UploadReport report = new UploadReport();
        if (activity.isUploaded()) {
            report.setAlreadyUploaded(true);
            report.setExternalReference(activity.externalReference());
            report.info("Activity " + activityId + " is already on Strava (" + activity.externalReference() + ").");
            return report;
        }
        if (!settings.isStravaConfigured()) {
            report.error("Missing Strava configuration. Check STRAVA_CLIENT_ID, STRAVA_CLIENT_SECRET and STRAVA_REFRESH_TOKEN.");
            return report;
        }

        String name = GpxTrackExporter.trackName(activity);
        String description = describe(detail.stats());
        try {
            String reference;
            if (settings.strava().uploadTrack()) {
                byte[] gpx = exporter.export(activity, detail.probes());
                reference = stravaUploadPort.uploadTrack(new StravaTrackUpload(
                        name, settings.strava().sportType(), description, "bike-tracker-" + activityId, gpx));
            } else {
                ActivityStats stats = detail.stats();
                reference = stravaUploadPort.createActivity(new StravaActivityDraft(
                        name,
                        settings.strava().sportType(),
                        stats.start().toLocalDateTime(),
                        stats.duration().getSeconds(),
                        stats.totalDistance(),
                        description));
            }
            report.setExternalReference(reference);
            if (storeReference(activityId, reference)) {
                report.info("Uploaded activity " + activityId + " to Strava (" + reference + ").");
                logger.info("Uploaded activity {} to Strava as {}", activityId, reference);
            } else {
                report.warn("Activity " + activityId + " was merged away during the upload; Strava reference "
                        + reference + " was not stored.");
                logger.warn("Activity {} disappeared while uploading, Strava reference {} not stored",
                        activityId, reference);
            }
        } catch (IOException e) {
            logger.error("Strava upload failed for activity {}", activityId, e);
            report.error("Strava upload failed: " + e.getMessage());
        }
        return report;
    }

    private boolean storeReference(long activityId, String reference) {
        Optional<Activity> stored = writer.write(() -> activityStore.findById(activityId)
                .map(activity -> activityStore.setExternalReference(activityId, reference)));
        return stored.isPresent();
    }

    private String describe(ActivityStats stats) {
        StringBuilder description = new StringBuilder()
                .append(String.format(Locale.ROOT, "%.1f km, %.0f m elevation gain", stats.totalDistanceKm(), stats.totalAltitudeGain()));
        if (stats.maxSpeed() != null) {
            description.append(String.format(Locale.ROOT, ", max %.1f km/h", stats.maxSpeed() * 3.6));
        }
        if (stats.movingTime() != null) {
            description.append(String.format(Locale.ROOT, ", %d min moving", stats.movingTime().toMinutes()));
        }
        return description.append(". Recorded by bike-tracker.").toString();
    }
}
