package com.bko.biketracker.tracking.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of probes. Identities are assigned on insert and grow with receipt time.
 */
public interface ProbeStore {

    /**
     * Stores a reading. The returned probe has a fresh identity and no activity.
     */
    Probe insert(ProbeReading reading, Instant receivedAt);

    Optional<Probe> findById(long id);

    /**
     * Most recently inserted probe, by identity.
     */
    Optional<Probe> findLast();

    /**
     * Probes with {@code afterId < id < beforeId}, ordered by identity.
     */
    List<Probe> findBetween(long afterId, long beforeId);

    /**
     * Members of an activity, ordered by identity.
     */
    List<Probe> findByActivity(long activityId);

    /**
     * Member of an activity with the highest identity.
     */
    Optional<Probe> findLastOfActivity(long activityId);

    /**
     * Probes received in {@code [from, to)}, ordered by identity.
     */
    List<Probe> findReceivedBetween(Instant from, Instant to);

    /**
     * The {@code limit} most recently received probes, newest first.
     */
    List<Probe> findLatest(int limit);

    void assignActivity(Collection<Long> probeIds, long activityId);

    /**
     * Moves every member of {@code sourceActivityId} to {@code targetActivityId}.
     *
     * @return number of probes moved
     */
    int reassignActivity(long sourceActivityId, long targetActivityId);
}
