package com.bko.biketracker.tracking.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProbeRepository extends JpaRepository<ProbeEntity, Long> {

    Optional<ProbeEntity> findFirstByOrderByIdDesc();

    List<ProbeEntity> findByIdGreaterThanAndIdLessThanOrderByIdAsc(Long afterId, Long beforeId);

    List<ProbeEntity> findByActivityIdOrderByIdAsc(Long activityId);

    Optional<ProbeEntity> findFirstByActivityIdOrderByIdDesc(Long activityId);

    List<ProbeEntity> findByReceivedAtGreaterThanEqualAndReceivedAtLessThanOrderByIdAsc(Instant from, Instant to);

    List<ProbeEntity> findAllByOrderByReceivedAtDescIdDesc(Pageable pageable);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProbeEntity p SET p.activityId = :activityId WHERE p.id IN :ids")
    int assignActivity(@Param("ids") Collection<Long> ids, @Param("activityId") Long activityId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProbeEntity p SET p.activityId = :targetId WHERE p.activityId = :sourceId")
    int reassignActivity(@Param("sourceId") Long sourceId, @Param("targetId") Long targetId);
}
