package com.birdopedia.archive;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.birdopedia.model.Capture;
import com.birdopedia.trips.Trip;
import com.birdopedia.trips.TripEngine;
import com.birdopedia.trips.TripSettings;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TripWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesStatsAndTripsCreatingDirectories() throws Exception {
        Capture a = new Capture("Robin", "a.jpg", "2024-05-12T08:00:00", 40.0, -74.0);
        a.setSrc("/birdopedia/Robin/a.jpg");
        Capture b = new Capture("Blue Jay", "b.jpg", "2024-05-12T08:30:00", 40.0, -74.0);
        b.setSrc("/birdopedia/Blue Jay/b.jpg");
        List<Trip> trips = new TripEngine(TripSettings.defaults(ZoneOffset.UTC))
                .build(List.of(a, b), Map.of("Robin", "2024-05-12")).getTrips();
        Path target = dir.resolve("public/birdopedia/trips/trips.json");

        new TripWriter(mapper).write(target, trips);

        assertTrue(Files.isRegularFile(target));
        JsonNode root = mapper.readTree(target.toFile());
        assertEquals(1, root.path("stats").path("tripCount").asInt());
        assertEquals(2, root.path("stats").path("totalPhotos").asInt());

        JsonNode trip = root.path("trips").get(0);
        assertEquals("trip-1", trip.path("id").asText());
        assertEquals(2, trip.path("imageCount").asInt());
        assertTrue(trip.path("hasNewSpecies").asBoolean());
        assertEquals("Robin", trip.path("newSpeciesLabel").asText());
        assertEquals(1, trip.path("coverIndex").asInt());
        assertEquals("b.jpg", trip.path("cover").path("filename").asText());
        assertEquals("Blue Jay", trip.path("images").get(1).path("bird").asText());
        assertFalse(trip.has("startMillis"));
        assertEquals("/birdopedia/map/index.html?species=Blue%20Jay&focus=all&image=b.jpg", trip.path("mapHref").asText());
    }

    @Test
    void emptyTripListStillWritesPayload() throws Exception {
        Path target = dir.resolve("trips.json");

        new TripWriter(mapper).write(target, List.of());

        JsonNode root = mapper.readTree(target.toFile());
        assertEquals("None yet", root.path("stats").path("largestTrip").asText());
        assertEquals(0, root.path("trips").size());
    }
}
