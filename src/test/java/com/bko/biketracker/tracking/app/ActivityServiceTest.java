package com.bko.biketracker.tracking.app;

import com.bko.biketracker.tracking.ActivityNotFoundException;
import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityAggregator;
import com.bko.biketracker.tracking.domain.InMemoryActivityStore;
import com.bko.biketracker.tracking.domain.InMemoryProbeStore;
import com.bko.biketracker.tracking.domain.Probe;
import com.bko.biketracker.tracking.domain.ProbeReadings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActivityServiceTest {
    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private InMemoryProbeStore probeStore;
    private InMemoryActivityStore activityStore;
    private ActivityService service;

    @BeforeEach
    void setUp() {
        probeStore = new InMemoryProbeStore();
        activityStore = new InMemoryActivityStore();
        service = new ActivityService(activityStore, probeStore, new ActivityAggregator(ZoneOffset.UTC),
                new SerializedWriter(TransactionOperations.withoutTransaction()));
    }

    @Test
    void loadActivityComputesStats() {
        Activity activity = activityWith(T0, 160, 48);

        ActivityDetail detail = service.loadActivity(activity.id());

        assertEquals(208.0, detail.stats().totalDistance());
        assertEquals(2, detail.probes().size());
    }

    @Test
    void loadUnknownActivityFails() {
        ActivityNotFoundException e = assertThrows(ActivityNotFoundException.class, () -> service.loadActivity(99));
        assertEquals(99, e.getActivityId());
    }

    @Test
    void mergeMovesProbesAndDeletesSource() {
        Activity target = activityWith(T0, 16, 32);
        Activity source = activityWith(T0.plusSeconds(7200), 64, 128);
        List<Probe> sourceProbes = probeStore.findByActivity(source.id());

        ActivityDetail merged = service.merge(source.id(), target.id());

        assertEquals(target.id(), merged.activity().id());
        assertEquals(4, merged.probes().size());
        assertEquals(240.0, merged.stats().totalDistance());
        assertTrue(activityStore.findById(source.id()).isEmpty());
        for (Probe probe : sourceProbes) {
            assertEquals(target.id(), probeStore.findById(probe.id()).orElseThrow().activityId());
        }
        assertThrows(ActivityNotFoundException.class, () -> service.loadActivity(source.id()));
    }

    @Test
    void mergeWithUnknownActivityChangesNothing() {
        Activity existing = activityWith(T0, 16, 16);

        assertThrows(ActivityNotFoundException.class, () -> service.merge(existing.id(), 42));
        assertThrows(ActivityNotFoundException.class, () -> service.merge(42, existing.id()));
        assertEquals(2, probeStore.findByActivity(existing.id()).size());
        assertTrue(activityStore.findById(existing.id()).isPresent());
    }

    @Test
    void mergeIntoItselfIsRejected() {
        Activity existing = activityWith(T0, 16, 16);

        assertThrows(IllegalArgumentException.class, () -> service.merge(existing.id(), existing.id()));
    }

    @Test
    void mergeOfUnknownActivityIntoItselfIsNotFound() {
        assertThrows(ActivityNotFoundException.class, () -> service.merge(42, 42));
    }

    private Activity activityWith(Instant start, double firstDistance, double secondDistance) {
        Activity activity = activityStore.create();
        Probe first = probeStore.insert(ProbeReadings.moving(1, firstDistance), start);
        Probe second = probeStore.insert(ProbeReadings.moving(2, secondDistance), start.plusSeconds(300));
        probeStore.assignActivity(List.of(first.id(), second.id()), activity.id());
        return activity;
    }
}
