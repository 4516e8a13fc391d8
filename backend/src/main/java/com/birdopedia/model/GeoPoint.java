package com.birdopedia.model;

import java.util.Objects;

/**
 * Latitude/longitude pair in decimal degrees.
 */
public final class GeoPoint {
    private final double lat;
    private final double lon;

    public GeoPoint(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoPoint other)) return false;
        return Double.compare(lat, other.lat) == 0 && Double.compare(lon, other.lon) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lat, lon);
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f)", lat, lon);
    }
}
