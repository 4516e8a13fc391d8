package com.birdopedia.trips;

import java.util.Collections;
import java.util.List;

import com.birdopedia.model.GeoPoint;

/**
 * A maximal set of same-day geotagged captures connected through pairwise
 * distances within the clustering radius.
 */
public final class GeoCluster {
    private final String dayKey;
    private final List<StampedCapture> captures;
    private final GeoPoint centroid;
    private final double maxSpreadKm;

    public GeoCluster(String dayKey, List<StampedCapture> captures, GeoPoint centroid, double maxSpreadKm) {
        this.dayKey = dayKey;
        this.captures = Collections.unmodifiableList(captures);
        this.centroid = centroid;
        this.maxSpreadKm = maxSpreadKm;
    }

    public String getDayKey() {
        return dayKey;
    }

    /** Members sorted ascending by capture time. */
    public List<StampedCapture> getCaptures() {
        return captures;
    }

    public GeoPoint getCentroid() {
        return centroid;
    }

    public double getMaxSpreadKm() {
        return maxSpreadKm;
    }

    public int size() {
        return captures.size();
    }

    @Override
    public String toString() {
        return String.format("GeoCluster[%s, %d captures, centroid=%s, spread=%.2fkm]",
                dayKey, captures.size(), centroid, maxSpreadKm);
    }
}
