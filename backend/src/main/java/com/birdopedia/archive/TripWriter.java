package com.birdopedia.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.birdopedia.exception.ArchiveException;
import com.birdopedia.trips.Trip;

/**
 * Writes the trips payload consumed by the trips page renderer.
 */
public class TripWriter {

    private static final Logger log = LoggerFactory.getLogger(TripWriter.class);

    private final ObjectMapper objectMapper;

    public TripWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(Path target, List<Trip> trips) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stats", TripArchiveStats.of(trips));
        payload.put("trips", trips);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), payload);
        } catch (IOException ex) {
            throw new ArchiveException("Failed to write trips to " + target, ex);
        }
        log.info("Wrote {} trips to {}", trips.size(), target);
        return target;
    }
}
