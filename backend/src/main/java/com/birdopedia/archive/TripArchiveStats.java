package com.birdopedia.archive;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.birdopedia.trips.Trip;

/**
 * Headline numbers for the trips page.
 */
public final class TripArchiveStats {
    private final int tripCount;
    private final int totalPhotos;
    private final int totalSpecies;
    private final int tripDays;
    private final String largestTrip;

    private TripArchiveStats(int tripCount, int totalPhotos, int totalSpecies, int tripDays, String largestTrip) {
        this.tripCount = tripCount;
        this.totalPhotos = totalPhotos;
        this.totalSpecies = totalSpecies;
        this.tripDays = tripDays;
        this.largestTrip = largestTrip;
    }

    public static TripArchiveStats of(List<Trip> trips) {
        int photos = 0;
        Set<String> species = new HashSet<>();
        Set<String> days = new HashSet<>();
        Trip largest = null;
        for (Trip trip : trips) {
            photos += trip.getImageCount();
            species.addAll(trip.getSpecies());
            days.add(trip.getDayKey());
            // trips arrive ranked, so the first maximum is the most recent one
            if (largest == null || trip.getImageCount() > largest.getImageCount()) {
                largest = trip;
            }
        }
        String largestLabel = largest != null
                ? largest.getDateLabel() + " (" + largest.getImageCount() + ")"
                : "None yet";
        return new TripArchiveStats(trips.size(), photos, species.size(), days.size(), largestLabel);
    }

    public int getTripCount() {
        return tripCount;
    }

    public int getTotalPhotos() {
        return totalPhotos;
    }

    public int getTotalSpecies() {
        return totalSpecies;
    }

    public int getTripDays() {
        return tripDays;
    }

    public String getLargestTrip() {
        return largestTrip;
    }
}
