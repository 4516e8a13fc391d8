package com.birdopedia.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.birdopedia.exception.ArchiveException;
import com.birdopedia.model.Capture;

/**
 * Reads the capture manifest produced by the metadata extraction stage. The file
 * is either a JSON array of captures or an object with a {@code captures} array.
 */
public class CaptureManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(CaptureManifestLoader.class);

    private final ObjectMapper objectMapper;

    public CaptureManifestLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Capture> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ArchiveException("Capture manifest not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            JsonNode root = objectMapper.readTree(is);
            JsonNode array = root != null && root.isObject() ? root.get("captures") : root;
            if (array == null || array.isNull()) {
                log.warn("Capture manifest {} has no captures", file);
                return new ArrayList<>();
            }
            if (!array.isArray()) {
                throw new ArchiveException("Capture manifest " + file + " must hold an array of captures");
            }
            List<Capture> captures = objectMapper.convertValue(array, new TypeReference<List<Capture>>() {});
            log.info("Loaded {} captures from {}", captures.size(), file);
            return captures;
        } catch (IOException ex) {
            throw new ArchiveException("Failed to read capture manifest " + file, ex);
        }
    }
}
