package com.birdopedia.trips;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.birdopedia.model.Capture;

/**
 * Buckets captures by local calendar day. Captures whose timestamp cannot be
 * resolved are left out and counted.
 */
public class DayPartitioner {

    public static class Result {
        private final Map<String, List<StampedCapture>> days;
        private final int skipped;

        private Result(Map<String, List<StampedCapture>> days, int skipped) {
            this.days = days;
            this.skipped = skipped;
        }

        /** Day key to captures sorted ascending by time, in ascending day order. */
        public Map<String, List<StampedCapture>> getDays() {
            return days;
        }

        public List<StampedCapture> getDay(String dayKey) {
            return days.getOrDefault(dayKey, Collections.emptyList());
        }

        public int getSkipped() {
            return skipped;
        }
    }

    private final CaptureClock clock;

    public DayPartitioner(CaptureClock clock) {
        this.clock = clock;
    }

    public Result partition(List<Capture> captures) {
        Map<String, List<StampedCapture>> days = new TreeMap<>();
        int skipped = 0;
        for (Capture capture : captures) {
            Optional<StampedCapture> stamped = clock.stamp(capture);
            if (stamped.isEmpty()) {
                skipped++;
                continue;
            }
            StampedCapture sc = stamped.get();
            days.computeIfAbsent(sc.getDayKey(), k -> new ArrayList<>()).add(sc);
        }
        // List.sort is stable: same-instant captures keep input order
        days.values().forEach(list -> list.sort(StampedCapture.CHRONOLOGICAL));
        return new Result(Collections.unmodifiableMap(days), skipped);
    }
}
