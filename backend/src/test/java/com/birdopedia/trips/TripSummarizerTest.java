package com.birdopedia.trips;

import org.junit.jupiter.api.Test;

import com.birdopedia.model.Capture;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.birdopedia.trips.CaptureFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TripSummarizerTest {

    private final TripSummarizer summarizer = new TripSummarizer("/birdopedia");

    @Test
    void durationsAreHumanReadable() {
        assertEquals("0m", TripSummarizer.formatDuration(0));
        assertEquals("0m", TripSummarizer.formatDuration(-5));
        assertEquals("45m", TripSummarizer.formatDuration(45));
        assertEquals("2h", TripSummarizer.formatDuration(120));
        assertEquals("1h 30m", TripSummarizer.formatDuration(90));
    }

    @Test
    void summarizesMergedCluster() {
        Trip trip = summarize(Map.of("Blue Jay", "2024-05-12", "Robin", "2023-01-01"));

        assertEquals("2024-05-12", trip.getDayKey());
        assertEquals("May 12, 2024", trip.getDateLabel());
        assertEquals("08:00–09:30", trip.getTimeRange());
        assertEquals("1h 30m", trip.getDurationLabel());
        assertEquals(3, trip.getImageCount());
        assertEquals(List.of("Blue Jay", "Robin"), trip.getSpecies());
        assertEquals(2, trip.getSpeciesCount());
        assertEquals("Robin (2)", trip.getTopSpeciesLabel());
        assertEquals("Canon EOS R5 + RF 100-500mm", trip.getGearLabel());
        assertEquals("Lakeside", trip.getLocationTitle());
        assertNull(trip.getId());
    }

    @Test
    void speciesFirstSeenOnTheTripDayAreNew() {
        Trip trip = summarize(Map.of("Blue Jay", "2024-05-12", "Robin", "2023-01-01"));

        assertTrue(trip.hasNewSpecies());
        assertEquals("Blue Jay", trip.getNewSpeciesLabel());
    }

    @Test
    void noNewSpeciesWhenAllSeenBefore() {
        Trip trip = summarize(Map.of());

        assertFalse(trip.hasNewSpecies());
        assertEquals("None", trip.getNewSpeciesLabel());
    }

    @Test
    void coverIsTheLastImageAndDrivesTheMapLink() {
        Trip trip = summarize(Map.of());

        assertEquals(2, trip.getCoverIndex());
        assertEquals("b.jpg", trip.getCover().getFilename());
        assertEquals("/birdopedia/map/index.html?species=Blue%20Jay&focus=all&image=b.jpg", trip.getMapHref());
    }

    @Test
    void imagesPassThroughCaptureFields() {
        Trip trip = summarize(Map.of());

        TripImage attached = trip.getImages().get(1);
        assertEquals("c.jpg", attached.getFilename());
        assertNull(attached.getLat());
        assertEquals(attached.getSrc(), attached.getThumbSrc());
        assertEquals("/birdopedia/Robin/index.html", attached.getSpeciesHref());
        assertEquals("May 12, 2024", attached.getCaptureDate());

        TripImage cover = trip.getCover();
        assertEquals(40.01, cover.getLat(), 1e-9);
        assertEquals("/birdopedia/Blue%20Jay/index.html", cover.getSpeciesHref());
    }

    @Test
    void unknownGearFallsBack() {
        Capture only = geo("Robin", "a.jpg", "2024-05-12T08:00:00", 40.0, -74.0);
        only.setCamera("Unknown");

        Trip trip = summarizer.summarize(mergedOf(List.of(only), List.of()), new LocationLabeler.Result("Lakeside", List.of()), Map.of());

        assertEquals("Unknown camera + Unknown lens", trip.getGearLabel());
        assertEquals("0m", trip.getDurationLabel());
        assertEquals("08:00–08:00", trip.getTimeRange());
    }

    @Test
    void topSpeciesTieIsAlphabetical() {
        Capture robin = geo("robin", "a.jpg", "2024-05-12T08:00:00", 40.0, -74.0);
        Capture jay = geo("Blue Jay", "b.jpg", "2024-05-12T08:10:00", 40.0, -74.0);

        Trip trip = summarizer.summarize(mergedOf(List.of(robin, jay), List.of()), new LocationLabeler.Result("Lakeside", List.of()), Map.of());

        assertEquals("Blue Jay (1)", trip.getTopSpeciesLabel());
        assertEquals(List.of("Blue Jay", "robin"), trip.getSpecies());
    }

    @Test
    void speciesPagesAreEncoded() {
        assertEquals("/birdopedia/Black-capped%20Chickadee/index.html", summarizer.speciesHref("Black-capped Chickadee"));
        assertEquals("/birdopedia/map/index.html?species=Wren&focus=all&image=IMG%20%231.jpg",
                summarizer.mapHref("Wren", "IMG #1.jpg"));
    }

    private Trip summarize(Map<String, String> firstSeen) {
        Capture a = geo("Robin", "a.jpg", "2024-05-12T08:00:00", 40.0, -74.0);
        a.setCamera("Canon EOS R5");
        a.setLens("RF 100-500mm");
        Capture b = geo("Blue Jay", "b.jpg", "2024-05-12T09:30:00", 40.01, -74.0);
        b.setCamera("Canon EOS R5");
        b.setLens("Unknown");
        Capture c = plain("Robin", "c.jpg", "2024-05-12T09:00:00");
        c.setCamera("Unknown");
        return summarizer.summarize(mergedOf(List.of(a, b), List.of(c)),
                new LocationLabeler.Result("Lakeside", List.of()), firstSeen);
    }

    private static MergedCluster mergedOf(List<Capture> geotagged, List<Capture> extras) {
        List<StampedCapture> geo = geotagged.stream().map(CaptureFixtures::stamp).sorted(StampedCapture.CHRONOLOGICAL).collect(Collectors.toList());
        List<StampedCapture> other = extras.stream().map(CaptureFixtures::stamp).collect(Collectors.toList());
        List<GeoCluster> clusters = new SpatialClusterer(30.0).cluster("2024-05-12", geo);
        return new CaptureMerger(ExtraCapturePolicy.ATTACH_TO_ALL).merge(clusters, other).get(0);
    }
}
