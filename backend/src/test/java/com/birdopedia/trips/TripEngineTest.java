package com.birdopedia.trips;

import org.junit.jupiter.api.Test;

import com.birdopedia.model.Capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.birdopedia.trips.CaptureFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TripEngineTest {

    private final TripEngine engine = new TripEngine(TripSettings.defaults(ZONE));

    private static Capture a() {
        return geo("Robin", "a.jpg", "2024-05-12T08:00:00", 40.000, -74.000);
    }

    private static Capture b() {
        return geo("Robin", "b.jpg", "2024-05-12T08:50:00", 40.200, -74.100);
    }

    private static Capture c() {
        return geo("Great Blue Heron", "c.jpg", "2024-05-12T10:00:00", 41.500, -75.500);
    }

    private static Capture d() {
        return plain("Song Sparrow", "d.jpg", "2024-05-12T09:00:00");
    }

    @Test
    void emptyInputHasNoTrips() {
        TripBatch batch = engine.build(List.of(), Map.of());

        assertTrue(batch.getTrips().isEmpty());
        assertEquals(0, batch.getSkippedCaptures());
    }

    @Test
    void nearbyCapturesFormOneTrip() {
        TripBatch batch = engine.build(List.of(a(), b()), Map.of());

        assertEquals(1, batch.getTrips().size());
        Trip trip = batch.getTrips().get(0);
        assertEquals("trip-1", trip.getId());
        assertEquals(2, trip.getImageCount());
        assertEquals(1, trip.getSpeciesCount());
        assertEquals("50m", trip.getDurationLabel());
        assertEquals("08:00–08:50", trip.getTimeRange());
        assertEquals("40.100, -74.050", trip.getLocationTitle());
        assertEquals(40.1, trip.getCentroid().getLat(), 1e-9);
        assertEquals(-74.05, trip.getCentroid().getLon(), 1e-9);
    }

    @Test
    void distantCaptureStartsSecondTrip() {
        TripBatch batch = engine.build(List.of(a(), b(), c()), Map.of());

        assertEquals(2, batch.getTrips().size());
        Trip first = batch.getTrips().get(0);
        Trip second = batch.getTrips().get(1);
        assertEquals(2, first.getImageCount());
        assertEquals("trip-1", first.getId());
        assertEquals(1, second.getImageCount());
        assertEquals("trip-2", second.getId());
        assertEquals(List.of("Great Blue Heron"), second.getSpecies());
    }

    @Test
    void nonGeotaggedCaptureJoinsEveryTripOfItsDay() {
        TripBatch batch = engine.build(List.of(a(), b(), c(), d()), Map.of());

        Trip first = batch.getTrips().get(0);
        Trip second = batch.getTrips().get(1);
        assertEquals(List.of("a.jpg", "b.jpg", "d.jpg"), filenames(first));
        assertEquals(List.of("d.jpg", "c.jpg"), filenames(second));
        assertEquals("1h", first.getDurationLabel());
        assertEquals(0, batch.getUnattachedCaptures());
    }

    @Test
    void largestClusterPolicyAttachesOnlyOnce() {
        TripEngine largest = new TripEngine(TripSettings.defaults(ZONE)
                .withExtraCapturePolicy(ExtraCapturePolicy.LARGEST_CLUSTER));

        TripBatch batch = largest.build(List.of(a(), b(), c(), d()), Map.of());

        assertEquals(3, batch.getTrips().get(0).getImageCount());
        assertEquals(1, batch.getTrips().get(1).getImageCount());
    }

    @Test
    void nonGeotaggedCapturesAloneMakeNoTrip() {
        TripBatch batch = engine.build(List.of(a(), plain("Song Sparrow", "e.jpg", "2024-05-13T09:00:00")), Map.of());

        assertEquals(1, batch.getTrips().size());
        assertEquals(1, batch.getTrips().get(0).getImageCount());
        assertEquals(1, batch.getUnattachedCaptures());
    }

    @Test
    void capturesWithoutTimeAreSkipped() {
        TripBatch batch = engine.build(List.of(a(), geo("Robin", "x.jpg", null, 40.0, -74.0), plain("Robin", "y.jpg", "garbage")), Map.of());

        assertEquals(1, batch.getTrips().size());
        assertEquals(2, batch.getSkippedCaptures());
    }

    @Test
    void outOfRangeCoordinatesCountAsNotGeotagged() {
        Capture bad = geo("Robin", "bad.jpg", "2024-05-12T09:00:00", 95.0, -74.0);

        TripBatch batch = engine.build(List.of(a(), bad), Map.of());

        assertEquals(1, batch.getTrips().size());
        assertEquals(List.of("a.jpg", "bad.jpg"), filenames(batch.getTrips().get(0)));
        assertNull(batch.getTrips().get(0).getImages().get(1).getLat());
    }

    @Test
    void tripsAreRankedNewestDayFirst() {
        Capture older = geo("Robin", "old.jpg", "2024-05-11T08:00:00", 40.0, -74.0);

        TripBatch batch = engine.build(List.of(older, a(), b()), Map.of());

        assertEquals(List.of("2024-05-12", "2024-05-11"),
                batch.getTrips().stream().map(Trip::getDayKey).collect(Collectors.toList()));
    }

    @Test
    void newSpeciesComeFromFirstSeenIndex() {
        TripBatch batch = engine.build(List.of(a(), b(), c()), Map.of("Robin", "2024-05-12", "Great Blue Heron", "2020-01-01"));

        assertTrue(batch.getTrips().get(0).hasNewSpecies());
        assertEquals("Robin", batch.getTrips().get(0).getNewSpeciesLabel());
        assertFalse(batch.getTrips().get(1).hasNewSpecies());
    }

    @Test
    void missingFirstSeenMeansNothingIsNew() {
        TripBatch batch = engine.build(List.of(a()), null);

        assertFalse(batch.getTrips().get(0).hasNewSpecies());
    }

    @Test
    void smallerRadiusSplitsTrip() {
        TripEngine tight = new TripEngine(TripSettings.defaults(ZONE).withClusterRadiusKm(10.0));

        assertEquals(2, tight.build(List.of(a(), b()), Map.of()).getTrips().size());
    }

    @Test
    void sameInputGivesSameOutput() {
        List<Capture> captures = List.of(a(), b(), c(), d());

        List<String> first = describe(engine.build(captures, Map.of()));
        List<Capture> reversed = new ArrayList<>(captures);
        Collections.reverse(reversed);
        List<String> second = describe(engine.build(reversed, Map.of()));

        assertEquals(first, second);
    }

    @Test
    void parallelDaysMatchSequentialResult() {
        List<Capture> captures = new ArrayList<>(List.of(a(), b(), c(), d()));
        for (int day = 1; day <= 9; day++) {
            captures.add(geo("Robin", "day" + day + ".jpg", "2024-06-0" + day + "T08:00:00", 40.0, -74.0));
        }
        TripEngine parallel = new TripEngine(TripSettings.defaults(ZONE).withParallelDays(true));

        assertEquals(describe(engine.build(captures, Map.of())), describe(parallel.build(captures, Map.of())));
    }

    private static List<String> filenames(Trip trip) {
        return trip.getImages().stream().map(TripImage::getFilename).collect(Collectors.toList());
    }

    private static List<String> describe(TripBatch batch) {
        return batch.getTrips().stream()
                .map(t -> t.getId() + "|" + t.getLocationTitle() + "|" + String.join(",", filenames(t)))
                .collect(Collectors.toList());
    }
}
