package com.bko.biketracker.tracking.domain;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryActivityStore implements ActivityStore {
    private final TreeMap<Long, Activity> activities = new TreeMap<>();
    private long nextId = 1;

    @Override
    public Activity create() {
        Activity activity = new Activity(nextId++, Instant.EPOCH, null);
        activities.put(activity.id(), activity);
        return activity;
    }

    @Override
    public Optional<Activity> findById(long id) {
        return Optional.ofNullable(activities.get(id));
    }

    @Override
    public Optional<Activity> findLatest() {
        return activities.isEmpty() ? Optional.empty() : Optional.of(activities.lastEntry().getValue());
    }

    @Override
    public List<Activity> findRecent(int limit) {
        return activities.descendingMap().values().stream().limit(limit).toList();
    }

    @Override
    public Activity setExternalReference(long id, String externalReference) {
        Activity activity = findById(id).orElseThrow(() -> new NoSuchElementException("Activity " + id));
        Activity updated = new Activity(id, activity.createdAt(), externalReference);
        activities.put(id, updated);
        return updated;
    }

    @Override
    public void delete(long id) {
        activities.remove(id);
    }

    public int size() {
        return activities.size();
    }
}
