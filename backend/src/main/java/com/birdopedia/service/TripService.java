package com.birdopedia.service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.birdopedia.archive.CaptureManifestLoader;
import com.birdopedia.archive.FirstSeenIndex;
import com.birdopedia.archive.GeocodeCache;
import com.birdopedia.archive.TripWriter;
import com.birdopedia.config.AppProperties;
import com.birdopedia.model.Capture;
import com.birdopedia.trips.CaptureClock;
import com.birdopedia.trips.TripBatch;
import com.birdopedia.trips.TripEngine;
import com.birdopedia.trips.TripSettings;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Runs the trip engine over posted capture batches or over the on-disk archive.
 */
@Service
public class TripService {

    private static final Logger log = LoggerFactory.getLogger(TripService.class);

    private static final String ARCHIVE_DIR_ENV = "BIRDOPEDIA_ARCHIVE_DIR";

    public static class ArchiveBuild {
        private final Path archiveDir;
        private final int totalCaptures;
        private final int geotaggedCaptures;
        private final int geocodedCaptures;
        private final int speciesTracked;
        private final TripBatch batch;

        public ArchiveBuild(Path archiveDir, int totalCaptures, int geotaggedCaptures, int geocodedCaptures,
                            int speciesTracked, TripBatch batch) {
            this.archiveDir = archiveDir;
            this.totalCaptures = totalCaptures;
            this.geotaggedCaptures = geotaggedCaptures;
            this.geocodedCaptures = geocodedCaptures;
            this.speciesTracked = speciesTracked;
            this.batch = batch;
        }

        public Path getArchiveDir() { return archiveDir; }
        public int getTotalCaptures() { return totalCaptures; }
        public int getGeotaggedCaptures() { return geotaggedCaptures; }
        public int getGeocodedCaptures() { return geocodedCaptures; }
        public int getSpeciesTracked() { return speciesTracked; }
        public TripBatch getBatch() { return batch; }
    }

    private final TripEngine tripEngine;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;
    private final CaptureManifestLoader manifestLoader;
    private final TripWriter tripWriter;

    private final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    public TripService(
        TripEngine tripEngine,
        AppProperties appProperties,
        ObjectMapper objectMapper,
        CaptureManifestLoader manifestLoader,
        TripWriter tripWriter
    ) {
        this.tripEngine = tripEngine;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
        this.manifestLoader = manifestLoader;
        this.tripWriter = tripWriter;
    }

    /**
     * Builds trips for a capture batch. When {@code firstSeenDayBySpecies} is null it is
     * derived from the batch itself.
     */
    public TripBatch buildTrips(List<Capture> captures, Map<String, String> firstSeenDayBySpecies, Double radiusKm) {
        TripEngine engine = tripEngine;
        if (radiusKm != null && radiusKm != tripEngine.getSettings().getClusterRadiusKm()) {
            engine = new TripEngine(tripEngine.getSettings().withClusterRadiusKm(radiusKm));
        }
        Map<String, String> firstSeen = firstSeenDayBySpecies != null
                ? firstSeenDayBySpecies
                : firstSeen(captures, engine.getSettings());
        return engine.build(captures, firstSeen);
    }

    public ArchiveBuild buildArchive() {
        Path dir = resolveArchiveDir();
        AppProperties.Archive archive = appProperties.getArchive();
        List<Capture> captures = manifestLoader.load(dir.resolve(archive.getCapturesFile()));

        GeocodeCache geocode = GeocodeCache.load(dir.resolve(archive.getGeocodeFile()), objectMapper);
        int geocoded = geocode.enrich(captures);
        int geotagged = (int) captures.stream().filter(Capture::isGeotagged).count();

        Map<String, String> firstSeen = firstSeen(captures, tripEngine.getSettings());
        TripBatch batch = tripEngine.build(captures, firstSeen);
        log.info("Archive {}: {} captures ({} geotagged, {} labelled from geocode cache) -> {} trips",
                dir, captures.size(), geotagged, geocoded, batch.getTrips().size());
        return new ArchiveBuild(dir, captures.size(), geotagged, geocoded, firstSeen.size(), batch);
    }

    public Path writeArchive(ArchiveBuild build) {
        Path target = build.getArchiveDir().resolve(appProperties.getArchive().getTripsFile());
        return tripWriter.write(target, build.getBatch().getTrips());
    }

    Path resolveArchiveDir() {
        String configured = resolveValue(appProperties.getArchive().getDir(), ARCHIVE_DIR_ENV);
        return Paths.get(StringUtils.hasText(configured) ? configured : ".").toAbsolutePath().normalize();
    }

    private static Map<String, String> firstSeen(List<Capture> captures, TripSettings settings) {
        return FirstSeenIndex.compute(captures, new CaptureClock(settings.getDefaultZone()));
    }

    private String resolveValue(String propertyValue, String key) {
        if (StringUtils.hasText(propertyValue)) {
            return propertyValue;
        }
        String systemValue = System.getenv(key);
        if (StringUtils.hasText(systemValue)) {
            return systemValue;
        }
        String dotenvValue = dotenv.get(key);
        return StringUtils.hasText(dotenvValue) ? dotenvValue : null;
    }
}
