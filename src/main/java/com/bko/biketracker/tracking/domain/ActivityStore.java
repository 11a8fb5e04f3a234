package com.bko.biketracker.tracking.domain;

import java.util.List;
import java.util.Optional;

public interface ActivityStore {

    /**
     * Creates an empty activity. Callers assign its first probe in the same transaction.
     */
    Activity create();

    Optional<Activity> findById(long id);

    /**
     * Most recently created activity, by identity.
     */
    Optional<Activity> findLatest();

    /**
     * The {@code limit} most recently created activities, newest first.
     */
    List<Activity> findRecent(int limit);

    Activity setExternalReference(long id, String externalReference);

    void delete(long id);
}
