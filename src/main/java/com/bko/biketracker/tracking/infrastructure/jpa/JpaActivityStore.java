package com.bko.biketracker.tracking.infrastructure.jpa;

import com.bko.biketracker.tracking.domain.Activity;
import com.bko.biketracker.tracking.domain.ActivityStore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Component
public class JpaActivityStore implements ActivityStore {
    private final ActivityRepository repository;
    private final Clock clock;

    public JpaActivityStore(ActivityRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Activity create() {
        ActivityEntity entity = new ActivityEntity();
        entity.setCreatedAt(clock.instant());
        return toActivity(repository.save(entity));
    }

    @Override
    public Optional<Activity> findById(long id) {
        return repository.findById(id).map(JpaActivityStore::toActivity);
    }

    @Override
    public Optional<Activity> findLatest() {
        return repository.findFirstByOrderByIdDesc().map(JpaActivityStore::toActivity);
    }

    @Override
    public List<Activity> findRecent(int limit) {
        return repository.findAllByOrderByIdDesc(PageRequest.of(0, limit)).stream()
                .map(JpaActivityStore::toActivity)
                .toList();
    }

    @Override
    public Activity setExternalReference(long id, String externalReference) {
        ActivityEntity entity = repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Activity " + id + " does not exist"));
        entity.setStravaRef(externalReference);
        return toActivity(repository.save(entity));
    }

    @Override
    public void delete(long id) {
        repository.deleteById(id);
    }

    private static Activity toActivity(ActivityEntity entity) {
        return new Activity(entity.getId(), entity.getCreatedAt(), entity.getStravaRef());
    }
}
