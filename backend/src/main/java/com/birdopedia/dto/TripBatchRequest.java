package com.birdopedia.dto;

import java.util.List;
import java.util.Map;

import com.birdopedia.model.Capture;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Captures to turn into trips. {@code firstSeenDayBySpecies} is optional and is
 * derived from the batch when omitted.
 */
public class TripBatchRequest {

    @NotNull
    private List<Capture> captures;

    private Map<String, String> firstSeenDayBySpecies;

    @Positive
    private Double clusterRadiusKm;

    public List<Capture> getCaptures() {
        return captures;
    }

    public void setCaptures(List<Capture> captures) {
        this.captures = captures;
    }

    public Map<String, String> getFirstSeenDayBySpecies() {
        return firstSeenDayBySpecies;
    }

    public void setFirstSeenDayBySpecies(Map<String, String> firstSeenDayBySpecies) {
        this.firstSeenDayBySpecies = firstSeenDayBySpecies;
    }

    public Double getClusterRadiusKm() {
        return clusterRadiusKm;
    }

    public void setClusterRadiusKm(Double clusterRadiusKm) {
        this.clusterRadiusKm = clusterRadiusKm;
    }
}
