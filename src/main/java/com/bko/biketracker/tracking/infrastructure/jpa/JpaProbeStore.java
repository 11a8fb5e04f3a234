package com.bko.biketracker.tracking.infrastructure.jpa;

import com.bko.biketracker.tracking.domain.Probe;
import com.bko.biketracker.tracking.domain.ProbeReading;
import com.bko.biketracker.tracking.domain.ProbeStore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class JpaProbeStore implements ProbeStore {
    private final ProbeRepository repository;

    public JpaProbeStore(ProbeRepository repository) {
        this.repository = repository;
    }

    @Override
    public Probe insert(ProbeReading reading, Instant receivedAt) {
        ProbeEntity entity = new ProbeEntity();
        entity.setReceivedAt(receivedAt);
        entity.setSeq(reading.sequence());
        entity.setLat(reading.latitude());
        entity.setLng(reading.longitude());
        entity.setAlt(reading.altitude());
        entity.setDist(reading.distance());
        entity.setAltGain(reading.altitudeGain());
        entity.setMaxSpeed(reading.maxSpeed());
        entity.setMovingTime(reading.movingTime() == null ? null : reading.movingTime().toMillis());
        entity.setReportInterval(reading.reportInterval() == null ? null : reading.reportInterval().getSeconds());
        return toProbe(repository.save(entity));
    }

    @Override
    public Optional<Probe> findById(long id) {
        return repository.findById(id).map(JpaProbeStore::toProbe);
    }

    @Override
    public Optional<Probe> findLast() {
        return repository.findFirstByOrderByIdDesc().map(JpaProbeStore::toProbe);
    }

    @Override
    public List<Probe> findBetween(long afterId, long beforeId) {
        return toProbes(repository.findByIdGreaterThanAndIdLessThanOrderByIdAsc(afterId, beforeId));
    }

    @Override
    public List<Probe> findByActivity(long activityId) {
        return toProbes(repository.findByActivityIdOrderByIdAsc(activityId));
    }

    @Override
    public Optional<Probe> findLastOfActivity(long activityId) {
        return repository.findFirstByActivityIdOrderByIdDesc(activityId).map(JpaProbeStore::toProbe);
    }

    @Override
    public List<Probe> findReceivedBetween(Instant from, Instant to) {
        return toProbes(repository.findByReceivedAtGreaterThanEqualAndReceivedAtLessThanOrderByIdAsc(from, to));
    }

    @Override
    public List<Probe> findLatest(int limit) {
        return toProbes(repository.findAllByOrderByReceivedAtDescIdDesc(PageRequest.of(0, limit)));
    }

    @Override
    public void assignActivity(Collection<Long> probeIds, long activityId) {
        if (probeIds.isEmpty()) {
            return;
        }
        repository.assignActivity(probeIds, activityId);
    }

    @Override
    public int reassignActivity(long sourceActivityId, long targetActivityId) {
        return repository.reassignActivity(sourceActivityId, targetActivityId);
    }

    private static List<Probe> toProbes(List<ProbeEntity> entities) {
        return entities.stream().map(JpaProbeStore::toProbe).toList();
    }

    static Probe toProbe(ProbeEntity entity) {
        return new Probe(
                entity.getId(),
                entity.getSeq(),
                entity.getReceivedAt(),
                entity.getLat(),
                entity.getLng(),
                entity.getAlt(),
                entity.getDist(),
                entity.getAltGain(),
                entity.getMaxSpeed(),
                entity.getMovingTime() == null ? null : Duration.ofMillis(entity.getMovingTime()),
                entity.getReportInterval() == null ? null : Duration.ofSeconds(entity.getReportInterval()),
                entity.getActivityId()
        );
    }
}
