package com.bko.biketracker.tracking.infrastructure.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(
        name = "probes",
        indexes = {
                @Index(name = "idx_probe_activity", columnList = "activity_id"),
                @Index(name = "idx_probe_received_at", columnList = "received_at")
        }
)
public class ProbeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(nullable = false, updatable = false)
    private Integer seq;

    @Column(nullable = false, updatable = false)
    private Double lat;

    @Column(nullable = false, updatable = false)
    private Double lng;

    @Column(updatable = false)
    private Double alt;

    @Column(nullable = false, updatable = false)
    private Double dist;

    @Column(name = "alt_gain", nullable = false, updatable = false)
    private Double altGain;

    @Column(name = "max_speed", updatable = false)
    private Double maxSpeed;

    /** Milliseconds. */
    @Column(name = "moving_time", updatable = false)
    private Long movingTime;

    /** Seconds since the device's previous report. */
    @Column(name = "report_interval", updatable = false)
    private Long reportInterval;

    @Column(name = "activity_id")
    private Long activityId;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Instant getReceivedAt() { return receivedAt; }
    public void setReceivedAt(Instant receivedAt) { this.receivedAt = receivedAt; }
    public Integer getSeq() { return seq; }
    public void setSeq(Integer seq) { this.seq = seq; }
    public Double getLat() { return lat; }
    public void setLat(Double lat) { this.lat = lat; }
    public Double getLng() { return lng; }
    public void setLng(Double lng) { this.lng = lng; }
    public Double getAlt() { return alt; }
    public void setAlt(Double alt) { this.alt = alt; }
    public Double getDist() { return dist; }
    public void setDist(Double dist) { this.dist = dist; }
    public Double getAltGain() { return altGain; }
    public void setAltGain(Double altGain) { this.altGain = altGain; }
    public Double getMaxSpeed() { return maxSpeed; }
    public void setMaxSpeed(Double maxSpeed) { this.maxSpeed = maxSpeed; }
    public Long getMovingTime() { return movingTime; }
    public void setMovingTime(Long movingTime) { this.movingTime = movingTime; }
    public Long getReportInterval() { return reportInterval; }
    public void setReportInterval(Long reportInterval) { this.reportInterval = reportInterval; }
    public Long getActivityId() { return activityId; }
    public void setActivityId(Long activityId) { this.activityId = activityId; }
}
