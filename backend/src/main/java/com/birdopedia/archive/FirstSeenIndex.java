package com.birdopedia.archive;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.birdopedia.model.Capture;
import com.birdopedia.trips.CaptureClock;

/**
 * Earliest capture day of every species over the whole archive, geotagged or not.
 * Computed once per build and handed to the trip engine.
 */
public final class FirstSeenIndex {

    private FirstSeenIndex() {
    }

    public static Map<String, String> compute(List<Capture> captures, CaptureClock clock) {
        Map<String, ZonedDateTime> earliest = new HashMap<>();
        for (Capture capture : captures) {
            if (capture.getSpecies() == null) {
                continue;
            }
            Optional<ZonedDateTime> at = clock.resolve(capture.getCaptureDateIso());
            if (at.isEmpty()) {
                continue;
            }
            earliest.merge(capture.getSpecies(), at.get(),
                    (a, b) -> a.toInstant().isAfter(b.toInstant()) ? b : a);
        }
        Map<String, String> firstSeen = new TreeMap<>();
        earliest.forEach((species, at) -> firstSeen.put(species, CaptureClock.dayKey(at)));
        return firstSeen;
    }
}
