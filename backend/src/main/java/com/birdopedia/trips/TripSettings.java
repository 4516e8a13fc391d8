package com.birdopedia.trips;

import java.time.ZoneId;

/**
 * Explicit engine configuration. Built once from {@code AppProperties} or directly in tests.
 */
public final class TripSettings {

    public static final double DEFAULT_CLUSTER_RADIUS_KM = 30.0;
    public static final double DEFAULT_TITLE_DEDUP_MILES = 3.0;
    public static final String DEFAULT_SITE_BASE_PATH = "/birdopedia";

    private final double clusterRadiusKm;
    private final double titleDedupMiles;
    private final ZoneId defaultZone;
    private final ExtraCapturePolicy extraCapturePolicy;
    private final boolean parallelDays;
    private final String siteBasePath;

    public TripSettings(double clusterRadiusKm, double titleDedupMiles, ZoneId defaultZone,
                        ExtraCapturePolicy extraCapturePolicy, boolean parallelDays, String siteBasePath) {
        if (!Double.isFinite(clusterRadiusKm) || clusterRadiusKm <= 0) {
            throw new IllegalArgumentException("cluster radius must be a positive number of km, got " + clusterRadiusKm);
        }
        if (!Double.isFinite(titleDedupMiles) || titleDedupMiles < 0) {
            throw new IllegalArgumentException("title dedup distance must be >= 0 miles, got " + titleDedupMiles);
        }
        this.clusterRadiusKm = clusterRadiusKm;
        this.titleDedupMiles = titleDedupMiles;
        this.defaultZone = defaultZone != null ? defaultZone : ZoneId.systemDefault();
        this.extraCapturePolicy = extraCapturePolicy != null ? extraCapturePolicy : ExtraCapturePolicy.ATTACH_TO_ALL;
        this.parallelDays = parallelDays;
        this.siteBasePath = siteBasePath != null ? stripTrailingSlash(siteBasePath) : DEFAULT_SITE_BASE_PATH;
    }

    public static TripSettings defaults(ZoneId zone) {
        return new TripSettings(DEFAULT_CLUSTER_RADIUS_KM, DEFAULT_TITLE_DEDUP_MILES, zone,
                ExtraCapturePolicy.ATTACH_TO_ALL, false, DEFAULT_SITE_BASE_PATH);
    }

    public TripSettings withClusterRadiusKm(double radiusKm) {
        return new TripSettings(radiusKm, titleDedupMiles, defaultZone, extraCapturePolicy, parallelDays, siteBasePath);
    }

    public TripSettings withExtraCapturePolicy(ExtraCapturePolicy policy) {
        return new TripSettings(clusterRadiusKm, titleDedupMiles, defaultZone, policy, parallelDays, siteBasePath);
    }

    public TripSettings withParallelDays(boolean parallel) {
        return new TripSettings(clusterRadiusKm, titleDedupMiles, defaultZone, extraCapturePolicy, parallel, siteBasePath);
    }

    public double getClusterRadiusKm() {
        return clusterRadiusKm;
    }

    public double getTitleDedupMiles() {
        return titleDedupMiles;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    public ExtraCapturePolicy getExtraCapturePolicy() {
        return extraCapturePolicy;
    }

    public boolean isParallelDays() {
        return parallelDays;
    }

    public String getSiteBasePath() {
        return siteBasePath;
    }

    private static String stripTrailingSlash(String path) {
        String trimmed = path.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return String.format("radius=%.1fkm, dedup=%.1fmi, zone=%s, extras=%s, parallel=%s",
                clusterRadiusKm, titleDedupMiles, defaultZone, extraCapturePolicy, parallelDays);
    }
}
