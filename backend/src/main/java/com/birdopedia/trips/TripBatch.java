package com.birdopedia.trips;

import java.util.Collections;
import java.util.List;

/**
 * Result of one engine run: ranked trips plus input accounting.
 */
public final class TripBatch {
    private final List<Trip> trips;
    private final int skippedCaptures;
    private final int unattachedCaptures;

    public TripBatch(List<Trip> trips, int skippedCaptures, int unattachedCaptures) {
        this.trips = Collections.unmodifiableList(trips);
        this.skippedCaptures = skippedCaptures;
        this.unattachedCaptures = unattachedCaptures;
    }

    public static TripBatch empty() {
        return new TripBatch(Collections.emptyList(), 0, 0);
    }

    public List<Trip> getTrips() {
        return trips;
    }

    /** Captures left out because their timestamp could not be resolved. */
    public int getSkippedCaptures() {
        return skippedCaptures;
    }

    /** Non-geotagged captures whose day has no geotagged cluster to join. */
    public int getUnattachedCaptures() {
        return unattachedCaptures;
    }
}
