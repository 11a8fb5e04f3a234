package com.bko.biketracker.tracking.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ActivityRepository extends JpaRepository<ActivityEntity, Long> {

    Optional<ActivityEntity> findFirstByOrderByIdDesc();

    List<ActivityEntity> findAllByOrderByIdDesc(Pageable pageable);
}
