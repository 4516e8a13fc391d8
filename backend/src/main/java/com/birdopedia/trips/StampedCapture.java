package com.birdopedia.trips;

import java.time.ZonedDateTime;
import java.util.Comparator;

import com.birdopedia.model.Capture;
import com.birdopedia.model.GeoPoint;

/**
 * A capture whose timestamp resolved to a local date-time, together with its day key.
 */
public final class StampedCapture {

    public static final Comparator<StampedCapture> CHRONOLOGICAL =
            Comparator.comparingLong(StampedCapture::getInstantMillis);

    private final Capture capture;
    private final ZonedDateTime capturedAt;
    private final String dayKey;

    public StampedCapture(Capture capture, ZonedDateTime capturedAt, String dayKey) {
        this.capture = capture;
        this.capturedAt = capturedAt;
        this.dayKey = dayKey;
    }

    public Capture getCapture() {
        return capture;
    }

    public ZonedDateTime getCapturedAt() {
        return capturedAt;
    }

    public String getDayKey() {
        return dayKey;
    }

    public long getInstantMillis() {
        return capturedAt.toInstant().toEpochMilli();
    }

    /**
     * Only meaningful for geotagged captures.
     */
    public GeoPoint getPoint() {
        return new GeoPoint(capture.getLat(), capture.getLon());
    }

    @Override
    public String toString() {
        return capture.getSpecies() + "/" + capture.getFilename() + " @ " + capturedAt;
    }
}
