package com.birdopedia.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.birdopedia.model.Capture;
import com.birdopedia.util.GeoMath;

/**
 * Read-only view of the reverse-geocode cache written by the data fetchers.
 * Points are keyed by coordinates rounded to four decimals.
 */
public class GeocodeCache {

    private static final Logger log = LoggerFactory.getLogger(GeocodeCache.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CacheFile {
        public Map<String, GeocodeEntry> points = new LinkedHashMap<>();
        public String updatedAt;
    }

    private final Map<String, GeocodeEntry> points;

    public GeocodeCache(Map<String, GeocodeEntry> points) {
        this.points = points != null ? points : Collections.emptyMap();
    }

    public static GeocodeCache empty() {
        return new GeocodeCache(Collections.emptyMap());
    }

    /**
     * Loads the cache; a missing or unreadable file yields an empty cache so that
     * trips still build, only with coordinate titles.
     */
    public static GeocodeCache load(Path file, ObjectMapper mapper) {
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("Geocode cache {} not found, trip titles will fall back to coordinates", file);
            return empty();
        }
        try (InputStream is = Files.newInputStream(file)) {
            CacheFile cache = mapper.readValue(is, CacheFile.class);
            log.info("Loaded {} geocoded points from {} (updated {})", cache.points.size(), file, cache.updatedAt);
            return new GeocodeCache(cache.points);
        } catch (IOException ex) {
            log.warn("Failed to read geocode cache {}, continuing without it: {}", file, ex.getMessage());
            return empty();
        }
    }

    public int size() {
        return points.size();
    }

    public Optional<GeocodeEntry> lookup(double lat, double lon) {
        String key = GeoMath.geocodeKey(lat, lon);
        return key == null ? Optional.empty() : Optional.ofNullable(points.get(key));
    }

    /**
     * Fills place labels on geotagged captures that carry none.
     *
     * @return number of captures that received labels
     */
    public int enrich(List<Capture> captures) {
        int enriched = 0;
        for (Capture capture : captures) {
            if (!capture.isGeotagged() || capture.hasPlaceLabels()) {
                continue;
            }
            Optional<GeocodeEntry> entry = lookup(capture.getLat(), capture.getLon());
            if (entry.isEmpty()) {
                continue;
            }
            GeocodeEntry e = entry.get();
            capture.setLocationLabel(e.getLabel());
            capture.setPark(e.getPark());
            capture.setSite(e.getSite());
            capture.setCity(e.getCity());
            capture.setState(e.getState());
            capture.setCountry(e.getCountry());
            enriched++;
        }
        return enriched;
    }
}
