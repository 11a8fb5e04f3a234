package com.bko.biketracker.integrations.strava;

import com.bko.biketracker.shared.AppSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.HttpResponseException;
import org.apache.hc.client5.http.entity.mime.MultipartEntityBuilder;
import org.apache.hc.client5.http.fluent.Form;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

@Component
public class StravaHttpClient implements StravaUploadPort {
    private static final Logger logger = LoggerFactory.getLogger(StravaHttpClient.class);
    private static final String STRAVA_API_BASE = "https://www.strava.com/api/v3";
    private static final String TOKEN_URL = "https://www.strava.com/oauth/token";
    private static final ContentType GPX = ContentType.create("application/gpx+xml", StandardCharsets.UTF_8);

    private final String clientId;
    private final String clientSecret;
    private final String refreshToken;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private String accessToken;
    private Instant accessTokenExpiresAt;

    public StravaHttpClient(AppSettings settings, Clock clock) {
        this.clientId = settings.strava().clientId();
        this.clientSecret = settings.strava().clientSecret();
        this.refreshToken = settings.strava().refreshToken();
        this.clock = clock;
    }

    @Override
    public String createActivity(StravaActivityDraft draft) throws IOException {
        String token = accessToken();

        Form form = Form.form()
                .add("name", draft.name())
                .add("sport_type", draft.sportType())
                .add("start_date_local", draft.startDateLocal().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .add("elapsed_time", String.valueOf(draft.elapsedSeconds()))
                .add("distance", String.valueOf(draft.distance()));
        if (draft.description() != null) {
            form.add("description", draft.description());
        }

        String body = execute(Request.post(STRAVA_API_BASE + "/activities")
                .addHeader("Authorization", "Bearer " + token)
                .bodyForm(form.build()), "creating activity");
        StravaActivity created = objectMapper.readValue(body, StravaActivity.class);
        if (created.getId() == null) {
            throw new IOException("Strava did not return an activity id");
        }
        logger.info("Created Strava activity {} ({})", created.getId(), draft.name());
        return String.valueOf(created.getId());
    }

    @Override
    public String uploadTrack(StravaTrackUpload upload) throws IOException {
        String token = accessToken();

        MultipartEntityBuilder multipart = MultipartEntityBuilder.create()
                .addBinaryBody("file", upload.gpx(), GPX, upload.externalId() + ".gpx")
                .addTextBody("data_type", "gpx")
                .addTextBody("name", upload.name(), ContentType.TEXT_PLAIN.withCharset(StandardCharsets.UTF_8))
                .addTextBody("sport_type", upload.sportType())
                .addTextBody("external_id", upload.externalId());
        if (upload.description() != null) {
            multipart.addTextBody("description", upload.description(),
                    ContentType.TEXT_PLAIN.withCharset(StandardCharsets.UTF_8));
        }
        HttpEntity entity = multipart.build();

        String body = execute(Request.post(STRAVA_API_BASE + "/uploads")
                .addHeader("Authorization", "Bearer " + token)
                .body(entity), "uploading track");
        JsonNode node = objectMapper.readTree(body);
        if (node.hasNonNull("error")) {
            throw new IOException("Strava rejected the upload: " + node.get("error").asText());
        }
        if (node.hasNonNull("activity_id")) {
            return node.get("activity_id").asText();
        }
        if (!node.hasNonNull("id")) {
            throw new IOException("Strava did not return an upload id");
        }
        logger.info("Strava upload {} accepted: {}", node.get("id").asText(), node.path("status").asText());
        return "upload/" + node.get("id").asText();
    }

    // The bean is shared by concurrent requests; token state is only touched under this monitor.
    private synchronized String accessToken() throws IOException {
        if (accessToken == null || accessTokenExpiresAt == null || !clock.instant().isBefore(accessTokenExpiresAt)) {
            refreshAccessToken();
        }
        return accessToken;
    }

    private synchronized void invalidateAccessToken() {
        accessToken = null;
        accessTokenExpiresAt = null;
    }

    private void refreshAccessToken() throws IOException {
        logger.info("Refreshing Strava access token...");
        Request request = Request.post(TOKEN_URL)
                .bodyForm(Form.form()
                        .add("client_id", clientId)
                        .add("client_secret", clientSecret)
                        .add("refresh_token", refreshToken)
                        .add("grant_type", "refresh_token")
                        .build());

        String body;
        try {
            body = request.execute().returnContent().asString();
        } catch (HttpResponseException e) {
            if (e.getStatusCode() == 400 || e.getStatusCode() == 401) {
                logger.error("Error refreshing Strava token: HTTP {}", e.getStatusCode());
                logger.error("Check STRAVA_CLIENT_ID, STRAVA_CLIENT_SECRET, and STRAVA_REFRESH_TOKEN.");
            }
            throw new IOException("Strava auth error: HTTP " + e.getStatusCode(), e);
        }

        JsonNode node = objectMapper.readTree(body);
        if (!node.hasNonNull("access_token")) {
            throw new IOException("Strava token response has no access_token");
        }
        this.accessToken = node.get("access_token").asText();
        // Strava tokens live six hours; without expires_at the token is refreshed on every call.
        this.accessTokenExpiresAt = node.has("expires_at")
                ? Instant.ofEpochSecond(node.get("expires_at").asLong()).minusSeconds(60)
                : clock.instant();

        if (node.has("scope")) {
            String scopes = node.get("scope").asText();
            if (!scopes.contains("activity:write")) {
                logger.warn("Token lacks 'activity:write' scope. Re-authorize with activity:write to upload activities.");
            }
        }
    }

    private String execute(Request request, String action) throws IOException {
        try {
            return request.execute().returnContent().asString();
        } catch (HttpResponseException e) {
            if (e.getStatusCode() == 401) {
                logger.warn("Strava 401 while {}: access token may be invalid or missing scopes.", action);
                invalidateAccessToken();
            }
            throw new IOException("Strava API error while " + action + ": HTTP " + e.getStatusCode(), e);
        }
    }
}
