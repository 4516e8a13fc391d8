package com.birdopedia;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.birdopedia.archive.TripArchiveStats;
import com.birdopedia.service.TripService;
import com.birdopedia.service.TripService.ArchiveBuild;
import com.birdopedia.trips.Trip;
import com.birdopedia.trips.TripBatch;

/**
 * Batch runner that rebuilds the trips payload from the archive's capture manifest.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.arguments="--trips"
 *
 * 1. Load the capture manifest and the reverse-geocode cache
 * 2. Work out the first-seen day of every species
 * 3. Cluster captures into trips and rank them
 * 4. Write trips.json for the trips page
 */
@Component
public class TripBuildRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TripBuildRunner.class);

    private final TripService tripService;

    public TripBuildRunner(TripService tripService) {
        this.tripService = tripService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        // Check if trips argument is passed, otherwise skip
        if (!args.containsOption("trips")) {
            return;
        }
        boolean dryRun = args.containsOption("dry-run");

        System.out.println();
        System.out.println("╔══════════════════════════════════════════════════════════════════╗");
        System.out.println("║           🐦 BIRDOPEDIA TRIP BUILDER                             ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════╝");
        System.out.println();

        ArchiveBuild build;
        try {
            build = tripService.buildArchive();
        } catch (RuntimeException e) {
            log.error("Trip build failed", e);
            System.err.println("   ❌ Error: " + e.getMessage());
            throw e;
        }
        TripBatch batch = build.getBatch();
        TripArchiveStats stats = TripArchiveStats.of(batch.getTrips());

        System.out.println("📊 Summary:");
        System.out.println("   • Archive: " + build.getArchiveDir());
        System.out.println("   • Captures: " + build.getTotalCaptures());
        System.out.println("   • Geotagged: " + build.getGeotaggedCaptures());
        System.out.println("   • Labelled from geocode cache: " + build.getGeocodedCaptures());
        System.out.println("   • Species tracked: " + build.getSpeciesTracked());
        System.out.println("   • Skipped (no capture time): " + batch.getSkippedCaptures());
        System.out.println("   • Unattached (no geotagged trip that day): " + batch.getUnattachedCaptures());
        System.out.println("   • Trips: " + stats.getTripCount() + " over " + stats.getTripDays() + " days");
        System.out.println("   • Trip photos: " + stats.getTotalPhotos());
        System.out.println("   • Species across trips: " + stats.getTotalSpecies());
        System.out.println("   • Largest trip: " + stats.getLargestTrip());
        System.out.println();
        System.out.println("📍 Trips:");
        for (Trip trip : batch.getTrips()) {
            String badge = trip.hasNewSpecies() ? "✨" : "•";
            System.out.println("   " + badge + " " + trip.getId() + " " + trip.getDateLabel() + " | " +
                trip.getLocationTitle() + ": " + trip.getImageCount() + " photos, " +
                trip.getSpeciesCount() + " species, " + trip.getDurationLabel());
        }
        System.out.println();

        if (dryRun) {
            System.out.println("🔎 Dry run, nothing written.");
            return;
        }
        Path written = tripService.writeArchive(build);
        System.out.println("✅ Wrote " + batch.getTrips().size() + " trips to " + written);
    }
}
