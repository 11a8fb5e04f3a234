package com.bko.biketracker.integrations.strava;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The parts of Strava's activity representation returned after creating an activity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaActivity {
    private Long id;
    private String name;
    @JsonProperty("sport_type")
    private String sportType;
    private Double distance;
    @JsonProperty("elapsed_time")
    private Integer elapsedTime;
    @JsonProperty("start_date_local")
    private String startDateLocal;
    @JsonProperty("external_id")
    private String externalId;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSportType() { return sportType; }
    public void setSportType(String sportType) { this.sportType = sportType; }
    public Double getDistance() { return distance; }
    public void setDistance(Double distance) { this.distance = distance; }
    public Integer getElapsedTime() { return elapsedTime; }
    public void setElapsedTime(Integer elapsedTime) { this.elapsedTime = elapsedTime; }
    public String getStartDateLocal() { return startDateLocal; }
    public void setStartDateLocal(String startDateLocal) { this.startDateLocal = startDateLocal; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
}
