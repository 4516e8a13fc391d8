package com.birdopedia.trips;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Final ordering: most recent day first, bigger trips first within a day, then
 * earlier start, westernmost centroid and title so equal-sized trips never
 * depend on discovery order. Ids are assigned in that order.
 */
public class TripRanker {

    static final Comparator<Trip> ORDER = Comparator.comparing(Trip::getDayKey).reversed()
            .thenComparing(Comparator.comparingInt(Trip::getImageCount).reversed())
            .thenComparingLong(Trip::getStartMillis)
            .thenComparingDouble(t -> t.getCentroid().getLon())
            .thenComparing(Trip::getLocationTitle);

    public List<Trip> rank(List<Trip> trips) {
        List<Trip> sorted = new ArrayList<>(trips);
        sorted.sort(ORDER);
        List<Trip> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withId("trip-" + (i + 1)));
        }
        return ranked;
    }
}
