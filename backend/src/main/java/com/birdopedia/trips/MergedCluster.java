package com.birdopedia.trips;

import java.util.Collections;
import java.util.List;

/**
 * A geo-cluster together with the non-geotagged captures attached to it.
 */
public final class MergedCluster {
    private final GeoCluster cluster;
    private final List<StampedCapture> captures;

    public MergedCluster(GeoCluster cluster, List<StampedCapture> captures) {
        this.cluster = cluster;
        this.captures = Collections.unmodifiableList(captures);
    }

    public GeoCluster getCluster() {
        return cluster;
    }

    public String getDayKey() {
        return cluster.getDayKey();
    }

    /** Geotagged and attached captures, ascending by time. */
    public List<StampedCapture> getCaptures() {
        return captures;
    }
}
