package com.birdopedia.dto;

import java.util.List;

import com.birdopedia.archive.TripArchiveStats;
import com.birdopedia.trips.Trip;
import com.birdopedia.trips.TripBatch;

public class TripBatchResponse {
    private final List<Trip> trips;
    private final TripArchiveStats stats;
    private final int skippedCaptures;
    private final int unattachedCaptures;

    public TripBatchResponse(TripBatch batch) {
        this.trips = batch.getTrips();
        this.stats = TripArchiveStats.of(batch.getTrips());
        this.skippedCaptures = batch.getSkippedCaptures();
        this.unattachedCaptures = batch.getUnattachedCaptures();
    }

    public List<Trip> getTrips() {
        return trips;
    }

    public TripArchiveStats getStats() {
        return stats;
    }

    public int getSkippedCaptures() {
        return skippedCaptures;
    }

    public int getUnattachedCaptures() {
        return unattachedCaptures;
    }
}
