package com.bko.biketracker.tracking.web;

import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityStore;
import com.bko.biketracker.tracking.domain.Probe;
import com.bko.biketracker.tracking.domain.ProbeReading;
import com.bko.biketracker.tracking.domain.ProbeStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class TrackerWebIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProbeStore probeStore;

    @Autowired
    private ActivityStore activityStore;

    @Test
    void storesProbeAndReturnsDownlinkToken() throws Exception {
        MvcResult result = mockMvc.perform(report("101", "10", "45"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.tracker1.downlinkData").isString())
                .andReturn();

        Probe probe = probeFrom(result);
        assertEquals(160.0, probe.distance());
        assertEquals(101, probe.sequence());
        assertNotNull(probe.activityId());
    }

    @Test
    void rejectsWrongDeviceWithoutStoring() throws Exception {
        long before = probeStore.findLatest(1000).size();

        mockMvc.perform(post("/new-probe")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("device", "intruder")
                        .param("seq", "1")
                        .param("lat", "50.0")
                        .param("lng", "5.0")
                        .param("dist", "1")
                        .param("alt_gain", "0")
                        .param("max_speed", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Bad request"));

        assertEquals(before, probeStore.findLatest(1000).size());
    }

    @Test
    void rejectsMissingField() throws Exception {
        mockMvc.perform(post("/new-probe")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("device", "tracker1")
                        .param("seq", "2"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void idleProbeIsBackfilledIntoActivityAndExposedThroughApi() throws Exception {
        Probe first = probeFrom(mockMvc.perform(report("201", "10", "45")).andExpect(status().isCreated()).andReturn());
        Probe idle = probeFrom(mockMvc.perform(report("202", "0", "0")).andExpect(status().isCreated()).andReturn());
        assertNull(idle.activityId());
        Probe last = probeFrom(mockMvc.perform(report("203", "3", "60")).andExpect(status().isCreated()).andReturn());
        assertEquals(first.activityId(), last.activityId());

        mockMvc.perform(get("/api/activities/{id}", first.activityId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(first.activityId()))
                .andExpect(jsonPath("$.probeCount").value(3))
                .andExpect(jsonPath("$.totalDistance").value(208.0))
                .andExpect(jsonPath("$.probes[1].id").value(idle.id()))
                .andExpect(jsonPath("$.maxSpeed", closeTo(5.556, 0.001)));

        mockMvc.perform(get("/activities/{id}/gpx", first.activityId()))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/gpx+xml"))
                .andExpect(content().string(containsString("<trkpt")));

        mockMvc.perform(get("/activities/{id}", first.activityId()))
                .andExpect(status().isOk())
                .andExpect(view().name("activity"));
    }

    @Test
    void retransmissionIsAcknowledgedWithOk() throws Exception {
        Probe first = probeFrom(mockMvc.perform(report("301", "2", "9")).andExpect(status().isCreated()).andReturn());

        MvcResult again = mockMvc.perform(report("301", "2", "9"))
                .andExpect(status().isOk())
                .andReturn();

        assertEquals(first.id(), probeFrom(again).id());
    }

    @Test
    void unknownActivityIsNotFound() throws Exception {
        mockMvc.perform(get("/api/activities/{id}", 999_999))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/activities/{id}/gpx", 999_999))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/activities/{id}/merge", 999_999).param("into", "999998"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/activities/{id}/merge", 999_999).param("into", "999999"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/activities/{id}/strava", 999_999))
                .andExpect(status().isNotFound());
    }

    @Test
    void stravaUploadWithoutCredentialsIsBadGateway() throws Exception {
        Probe probe = probeFrom(mockMvc.perform(report("401", "5", "30")).andExpect(status().isCreated()).andReturn());

        mockMvc.perform(post("/api/activities/{id}/strava", probe.activityId()))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void mergeMovesProbesAndRemovesSource() throws Exception {
        Activity morning = storedActivity(Instant.parse("2024-05-01T08:00:00Z"));
        Activity evening = storedActivity(Instant.parse("2024-05-01T18:00:00Z"));
        Activity night = storedActivity(Instant.parse("2024-05-01T22:00:00Z"));

        mockMvc.perform(post("/activities/{id}/merge", evening.id()).param("into", String.valueOf(morning.id())))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/activities/" + morning.id()));

        mockMvc.perform(post("/api/activities/{id}/merge", night.id()).param("into", String.valueOf(morning.id())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(morning.id()))
                .andExpect(jsonPath("$.probeCount").value(3))
                .andExpect(jsonPath("$.start").value("2024-05-01T10:00+02:00"));

        mockMvc.perform(get("/api/activities/{id}", evening.id()))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/activities/{id}/merge", morning.id()).param("into", String.valueOf(morning.id())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").isString());
    }

    @Test
    void probesCanBeQueriedByReceiptWindow() throws Exception {
        storedActivity(Instant.parse("2023-01-01T08:00:00Z"));

        mockMvc.perform(get("/api/probes")
                        .param("from", "2023-01-01T00:00:00Z")
                        .param("to", "2023-01-02T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(get("/api/probes")
                        .param("from", "2023-01-02T00:00:00Z")
                        .param("to", "2023-01-01T00:00:00Z"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void dashboardRenders() throws Exception {
        mockMvc.perform(report("501", "4", "12")).andExpect(status().isCreated());

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(content().string(containsString("Latest probes")));
    }

    private static org.springframework.test.web.servlet.RequestBuilder report(String seq, String dist, String maxSpeed) {
        return post("/new-probe")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("device", "tracker1")
                .param("seq", seq)
                .param("lat", "50.63")
                .param("lng", "5.57")
                .param("alt", "180")
                .param("dist", dist)
                .param("alt_gain", "1")
                .param("max_speed", maxSpeed);
    }

    private Activity storedActivity(Instant receivedAt) {
        Activity activity = activityStore.create();
        Probe probe = probeStore.insert(new ProbeReading(1, 50.63, 5.57, 180.0, 100.0, 2.0, 4.0, null, null), receivedAt);
        probeStore.assignActivity(List.of(probe.id()), activity.id());
        return activity;
    }

    private Probe probeFrom(MvcResult result) throws Exception {
        String body = result.getResponse().getContentAsString();
        String token = body.replaceAll(".*\"downlinkData\"\\s*:\\s*\"([0-9a-f]+)\".*", "$1");
        return probeStore.findById(Long.parseLong(token, 16)).orElseThrow();
    }
}
