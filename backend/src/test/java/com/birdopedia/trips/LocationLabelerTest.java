package com.birdopedia.trips;

import org.junit.jupiter.api.Test;

import com.birdopedia.model.Capture;
import com.birdopedia.model.GeoPoint;

import java.util.List;

import static com.birdopedia.trips.CaptureFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LocationLabelerTest {

    private static final GeoPoint CENTER = new GeoPoint(40.6, -73.5);

    private final LocationLabeler labeler = new LocationLabeler(3.0);

    @Test
    void normalizeUnifiesApostrophesAndSpacing() {
        assertEquals("jones beach's", LocationLabeler.normalize("  Jones   Beach’s "));
        assertEquals("", LocationLabeler.normalize(null));
    }

    @Test
    void qualityRewardsCapitalsThenLength() {
        assertEquals(32, LocationLabeler.quality("Central Park"));
        assertTrue(LocationLabeler.quality("Central Park") > LocationLabeler.quality("central park"));
    }

    @Test
    void administrativeNamesAreGeneric() {
        assertTrue(LocationLabeler.isGenericAdmin("Town of Hempstead"));
        assertTrue(LocationLabeler.isGenericAdmin("city of  Long Beach"));
        assertTrue(LocationLabeler.isGenericAdmin("Nassau County"));
        assertTrue(LocationLabeler.isGenericAdmin("Oyster Bay Township"));
        assertFalse(LocationLabeler.isGenericAdmin("Freeport"));
        assertFalse(LocationLabeler.isGenericAdmin("Countyline Park"));
    }

    @Test
    void twoDistantParksBothAnchorTheTitle() {
        // ~4.4 miles apart
        List<Capture> captures = List.of(
                labelled("Jones Beach State Park", null, 40.59, -73.51),
                labelled("Jones Beach State Park", null, 40.59, -73.51),
                labelled("Tobay Beach", null, 40.61, -73.43));

        assertEquals("Jones Beach State Park, Tobay Beach", labeler.title(captures, CENTER));
    }

    @Test
    void nearbyParkIsDroppedInFavourOfTheMorePhotographedOne() {
        List<Capture> captures = List.of(
                labelled("Jones Beach State Park", null, 40.59, -73.51),
                labelled("Jones Beach State Park", null, 40.59, -73.51),
                labelled("West End Boardwalk", null, 40.595, -73.52));

        assertEquals("Jones Beach State Park", labeler.title(captures, CENTER));
    }

    @Test
    void atMostTwoParksAreUsed() {
        List<Capture> captures = List.of(
                labelled("Alpha Park", null, 40.0, -74.0),
                labelled("Alpha Park", null, 40.0, -74.0),
                labelled("Bravo Park", null, 40.2, -74.0),
                labelled("Bravo Park", null, 40.2, -74.0),
                labelled("Charlie Park", null, 40.4, -74.0));

        assertEquals("Alpha Park, Bravo Park", labeler.title(captures, CENTER));
    }

    @Test
    void bestSpellingOfALabelIsShown() {
        List<Capture> captures = List.of(
                labelled("central  park", null, 40.78, -73.96),
                labelled("Central Park", null, 40.78, -73.96));

        assertEquals("Central Park", labeler.title(captures, CENTER));
    }

    @Test
    void distantCityIsAppendedAfterParks() {
        // ~5.8 miles from the park
        List<Capture> captures = List.of(
                labelled("Marine Nature Study Area", null, 40.63, -73.56),
                labelled(null, "Massapequa", 40.68, -73.47),
                labelled(null, "Town of Oyster Bay", 40.75, -73.40));

        assertEquals("Marine Nature Study Area, Massapequa", labeler.title(captures, CENTER));
    }

    @Test
    void cityNextToAnAnchorIsNotRepeated() {
        List<Capture> captures = List.of(
                labelled("Marine Nature Study Area", "Oceanside", 40.63, -73.56));

        assertEquals("Marine Nature Study Area", labeler.title(captures, CENTER));
    }

    @Test
    void withoutParksTheFirstTwoCitiesInCaptureOrderAreUsed() {
        List<Capture> captures = List.of(
                labelled(null, "Town of Hempstead", 40.65, -73.58),
                labelled(null, "Town of Hempstead", 40.65, -73.58),
                labelled(null, "Freeport", 40.65, -73.58),
                labelled(null, "Baldwin", 40.66, -73.61),
                labelled(null, "Baldwin", 40.66, -73.61));

        assertEquals("Town of Hempstead, Freeport", labeler.title(captures, CENTER));
    }

    @Test
    void titleStopsAtFourLabels() {
        // anchors and cities are each ~13.8 miles apart
        List<Capture> captures = List.of(
                labelled("Alpha Park", null, 40.0, -74.0),
                labelled("Alpha Park", null, 40.0, -74.0),
                labelled("Bravo Park", null, 40.2, -74.0),
                labelled(null, "Cedar", 40.4, -74.0),
                labelled(null, "Cedar", 40.4, -74.0),
                labelled(null, "Cedar", 40.4, -74.0),
                labelled(null, "Dover", 40.6, -74.0),
                labelled(null, "Dover", 40.6, -74.0),
                labelled(null, "Easton", 40.8, -74.0));

        assertEquals("Alpha Park, Bravo Park, Cedar, Dover", labeler.title(captures, CENTER));
    }

    @Test
    void genericAnchorIsHiddenWhenASpecificLabelExists() {
        // ~3.6 miles apart
        List<Capture> captures = List.of(
                labelled("Nassau County", null, 40.70, -73.60),
                labelled(null, "Freeport", 40.65, -73.58));

        assertEquals("Freeport", labeler.title(captures, CENTER));
    }

    @Test
    void loneGenericAnchorIsStillShown() {
        List<Capture> captures = List.of(labelled("Nassau County", null, 40.70, -73.60));

        assertEquals("Nassau County", labeler.title(captures, CENTER));
    }

    @Test
    void equallyRankedParksKeepFirstAppearanceOrder() {
        List<Capture> captures = List.of(
                labelled("Zulu Park", null, 40.0, -74.0),
                labelled("Able Park", null, 40.2, -74.0));

        assertEquals("Zulu Park, Able Park", labeler.title(captures, CENTER));
    }

    @Test
    void genericCitiesAreUsedWhenNothingElseExists() {
        List<Capture> captures = List.of(labelled(null, "Town of Hempstead", 40.65, -73.58));

        assertEquals("Town of Hempstead", labeler.title(captures, CENTER));
    }

    @Test
    void freeFormLabelIsTheLastNamedFallback() {
        Capture capture = geo("Robin", "a.jpg", "2024-05-12T08:00:00", 40.6, -73.5);
        capture.setLocationLabel("Somewhere on the South Shore");

        assertEquals("Somewhere on the South Shore", labeler.title(List.of(capture), CENTER));
    }

    @Test
    void unlabelledCapturesFallBackToCentroidCoordinates() {
        Capture capture = geo("Robin", "a.jpg", "2024-05-12T08:00:00", 40.6, -73.5);

        assertEquals("40.600, -73.500", labeler.title(List.of(capture), CENTER));
    }

    @Test
    void locationsListEachDistinctCaptureLabel() {
        Capture named = geo("Robin", "a.jpg", "2024-05-12T08:00:00", 40.6, -73.5);
        named.setLocationLabel("Jones Beach, NY");
        Capture parts = geo("Robin", "b.jpg", "2024-05-12T08:10:00", 40.65, -73.58);
        parts.setCity("Freeport");
        parts.setState("New York");
        parts.setCountry("United States");
        Capture bare = geo("Robin", "c.jpg", "2024-05-12T08:20:00", 40.7, -73.6);

        List<String> locations = labeler.locations(List.of(named, parts, named, bare));

        assertEquals(List.of("Jones Beach, NY", "Freeport, New York, United States", "40.700, -73.600"), locations);
    }

    @Test
    void labelCombinesTitleAndLocations() {
        Capture capture = labelled("Tobay Beach", null, 40.61, -73.43);

        LocationLabeler.Result result = labeler.label(List.of(stamp(capture)), CENTER);

        assertEquals("Tobay Beach", result.getTitle());
        assertEquals(List.of("40.610, -73.430"), result.getLocations());
    }
}
