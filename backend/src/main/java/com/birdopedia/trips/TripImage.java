package com.birdopedia.trips;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-image fields the trips page renders. Values are passed through from the capture.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TripImage {
    private final String src;
    private final String thumbSrc;
    private final String bird;
    private final String speciesHref;
    private final String filename;
    private final String captureDate;
    private final String captureDateIso;
    private final Double lat;
    private final Double lon;

    public TripImage(String src, String thumbSrc, String bird, String speciesHref, String filename,
                     String captureDate, String captureDateIso, Double lat, Double lon) {
        this.src = src;
        this.thumbSrc = thumbSrc;
        this.bird = bird;
        this.speciesHref = speciesHref;
        this.filename = filename;
        this.captureDate = captureDate;
        this.captureDateIso = captureDateIso;
        this.lat = lat;
        this.lon = lon;
    }

    public String getSrc() {
        return src;
    }

    public String getThumbSrc() {
        return thumbSrc;
    }

    public String getBird() {
        return bird;
    }

    public String getSpeciesHref() {
        return speciesHref;
    }

    public String getFilename() {
        return filename;
    }

    public String getCaptureDate() {
        return captureDate;
    }

    public String getCaptureDateIso() {
        return captureDateIso;
    }

    public Double getLat() {
        return lat;
    }

    public Double getLon() {
        return lon;
    }
}
