package com.birdopedia.util;

import java.util.List;
import java.util.Locale;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

import com.birdopedia.model.GeoPoint;

/**
 * Spherical distance and centroid helpers shared by the clustering and labeling stages.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_PER_MILE = 1.609344;

    private static final int WGS84_SRID = 4326;
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private GeoMath() {
    }

    public static boolean isValidLatitude(double lat) {
        return Double.isFinite(lat) && lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lon) {
        return Double.isFinite(lon) && lon >= -180 && lon <= 180;
    }

    public static boolean isValidCoordinate(double lat, double lon) {
        return isValidLatitude(lat) && isValidLongitude(lon);
    }

    /**
     * Great-circle distance in kilometres.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                        Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double haversineKm(GeoPoint a, GeoPoint b) {
        return haversineKm(a.getLat(), a.getLon(), b.getLat(), b.getLon());
    }

    public static double haversineMiles(GeoPoint a, GeoPoint b) {
        return haversineKm(a, b) / KM_PER_MILE;
    }

    /**
     * Arithmetic mean of the given points. JTS computes the centroid of a
     * MultiPoint as the plain coordinate average, which is what trips display.
     */
    public static GeoPoint centroid(List<GeoPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("centroid requires at least one point");
        }
        Coordinate[] coordinates = new Coordinate[points.size()];
        for (int i = 0; i < points.size(); i++) {
            GeoPoint p = points.get(i);
            // JTS is x/y ordered: longitude first
            coordinates[i] = new Coordinate(p.getLon(), p.getLat());
        }
        MultiPoint multiPoint = GEOMETRY_FACTORY.createMultiPointFromCoords(coordinates);
        Point center = multiPoint.getCentroid();
        return new GeoPoint(center.getY(), center.getX());
    }

    /**
     * Largest distance in kilometres from {@code center} to any of {@code points}; 0 for an empty list.
     */
    public static double maxDistanceKm(GeoPoint center, List<GeoPoint> points) {
        double max = 0;
        for (GeoPoint p : points) {
            max = Math.max(max, haversineKm(center, p));
        }
        return max;
    }

    /**
     * Formats a point as {@code "40.123, -74.456"}.
     */
    public static String formatCoordinates(double lat, double lon) {
        return String.format(Locale.ROOT, "%.3f, %.3f", lat, lon);
    }

    /**
     * Key used by the reverse-geocode cache: coordinates rounded to four decimals (~11m).
     */
    public static String geocodeKey(double lat, double lon) {
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            return null;
        }
        return String.format(Locale.ROOT, "%.4f,%.4f", lat, lon);
    }
}
