package com.birdopedia.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.birdopedia.trips.ExtraCapturePolicy;
import com.birdopedia.trips.TripSettings;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Trips trips = new Trips();
    private final Archive archive = new Archive();
    private final Site site = new Site();

    public Trips getTrips() {
        return trips;
    }

    public Archive getArchive() {
        return archive;
    }

    public Site getSite() {
        return site;
    }

    public static class Trips {
        private double clusterRadiusKm = TripSettings.DEFAULT_CLUSTER_RADIUS_KM;
        private double titleDedupMiles = TripSettings.DEFAULT_TITLE_DEDUP_MILES;
        // blank means the JVM's zone
        private String defaultZone = "";
        private ExtraCapturePolicy extraCapturePolicy = ExtraCapturePolicy.ATTACH_TO_ALL;
        private boolean parallelDays = false;

        public double getClusterRadiusKm() {
            return clusterRadiusKm;
        }

        public void setClusterRadiusKm(double clusterRadiusKm) {
            this.clusterRadiusKm = clusterRadiusKm;
        }

        public double getTitleDedupMiles() {
            return titleDedupMiles;
        }

        public void setTitleDedupMiles(double titleDedupMiles) {
            this.titleDedupMiles = titleDedupMiles;
        }

        public String getDefaultZone() {
            return defaultZone;
        }

        public void setDefaultZone(String defaultZone) {
            this.defaultZone = defaultZone;
        }

        public ExtraCapturePolicy getExtraCapturePolicy() {
            return extraCapturePolicy;
        }

        public void setExtraCapturePolicy(ExtraCapturePolicy extraCapturePolicy) {
            this.extraCapturePolicy = extraCapturePolicy;
        }

        public boolean isParallelDays() {
            return parallelDays;
        }

        public void setParallelDays(boolean parallelDays) {
            this.parallelDays = parallelDays;
        }
    }

    public static class Archive {
        private String dir = "";
        private String capturesFile = "data/captures.json";
        private String geocodeFile = "data/geocode.json";
        private String tripsFile = "public/birdopedia/trips/trips.json";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getCapturesFile() {
            return capturesFile;
        }

        public void setCapturesFile(String capturesFile) {
            this.capturesFile = capturesFile;
        }

        public String getGeocodeFile() {
            return geocodeFile;
        }

        public void setGeocodeFile(String geocodeFile) {
            this.geocodeFile = geocodeFile;
        }

        public String getTripsFile() {
            return tripsFile;
        }

        public void setTripsFile(String tripsFile) {
            this.tripsFile = tripsFile;
        }
    }

    public static class Site {
        private String basePath = TripSettings.DEFAULT_SITE_BASE_PATH;

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }
    }
}
