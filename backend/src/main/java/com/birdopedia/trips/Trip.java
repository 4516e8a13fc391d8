package com.birdopedia.trips;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.birdopedia.model.GeoPoint;

/**
 * One inferred field outing. Immutable; the id is positional within a single run.
 */
public final class Trip {
    private final String id;
    private final String dayKey;
    private final String locationTitle;
    private final String dateLabel;
    private final String durationLabel;
    private final String timeRange;
    private final String topSpeciesLabel;
    private final boolean hasNewSpecies;
    private final String newSpeciesLabel;
    private final String gearLabel;
    private final List<String> species;
    private final List<String> locations;
    private final GeoPoint centroid;
    private final double maxSpreadKm;
    private final List<TripImage> images;
    private final String mapHref;
    private final long startMillis;

    private Trip(Builder b) {
        this.id = b.id;
        this.dayKey = b.dayKey;
        this.locationTitle = b.locationTitle;
        this.dateLabel = b.dateLabel;
        this.durationLabel = b.durationLabel;
        this.timeRange = b.timeRange;
        this.topSpeciesLabel = b.topSpeciesLabel;
        this.hasNewSpecies = b.hasNewSpecies;
        this.newSpeciesLabel = b.newSpeciesLabel;
        this.gearLabel = b.gearLabel;
        this.species = Collections.unmodifiableList(b.species);
        this.locations = Collections.unmodifiableList(b.locations);
        this.centroid = b.centroid;
        this.maxSpreadKm = b.maxSpreadKm;
        this.images = Collections.unmodifiableList(b.images);
        this.mapHref = b.mapHref;
        this.startMillis = b.startMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this trip carrying a new id.
     */
    public Trip withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .dayKey(dayKey)
                .locationTitle(locationTitle)
                .dateLabel(dateLabel)
                .durationLabel(durationLabel)
                .timeRange(timeRange)
                .topSpeciesLabel(topSpeciesLabel)
                .newSpecies(hasNewSpecies, newSpeciesLabel)
                .gearLabel(gearLabel)
                .species(species)
                .locations(locations)
                .centroid(centroid)
                .maxSpreadKm(maxSpreadKm)
                .images(images)
                .mapHref(mapHref)
                .startMillis(startMillis);
    }

    public String getId() {
        return id;
    }

    public String getDayKey() {
        return dayKey;
    }

    public String getLocationTitle() {
        return locationTitle;
    }

    public String getDateLabel() {
        return dateLabel;
    }

    public String getDurationLabel() {
        return durationLabel;
    }

    public String getTimeRange() {
        return timeRange;
    }

    public int getImageCount() {
        return images.size();
    }

    public int getSpeciesCount() {
        return species.size();
    }

    public String getTopSpeciesLabel() {
        return topSpeciesLabel;
    }

    @JsonProperty("hasNewSpecies")
    public boolean hasNewSpecies() {
        return hasNewSpecies;
    }

    public String getNewSpeciesLabel() {
        return newSpeciesLabel;
    }

    public String getGearLabel() {
        return gearLabel;
    }

    public List<String> getSpecies() {
        return species;
    }

    public List<String> getLocations() {
        return locations;
    }

    public GeoPoint getCentroid() {
        return centroid;
    }

    public double getMaxSpreadKm() {
        return maxSpreadKm;
    }

    public List<TripImage> getImages() {
        return images;
    }

    /** The cover is the chronologically last image. */
    public int getCoverIndex() {
        return images.size() - 1;
    }

    public TripImage getCover() {
        return images.get(getCoverIndex());
    }

    public String getMapHref() {
        return mapHref;
    }

    /** Epoch millis of the first capture; secondary ordering key. */
    @JsonIgnore
    public long getStartMillis() {
        return startMillis;
    }

    @Override
    public String toString() {
        return String.format("Trip[%s %s \"%s\" images=%d species=%d]",
                id, dayKey, locationTitle, getImageCount(), getSpeciesCount());
    }

    public static final class Builder {
        private String id;
        private String dayKey;
        private String locationTitle;
        private String dateLabel;
        private String durationLabel;
        private String timeRange;
        private String topSpeciesLabel;
        private boolean hasNewSpecies;
        private String newSpeciesLabel;
        private String gearLabel;
        private List<String> species = Collections.emptyList();
        private List<String> locations = Collections.emptyList();
        private GeoPoint centroid;
        private double maxSpreadKm;
        private List<TripImage> images = Collections.emptyList();
        private String mapHref;
        private long startMillis;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder dayKey(String dayKey) {
            this.dayKey = dayKey;
            return this;
        }

        public Builder locationTitle(String locationTitle) {
            this.locationTitle = locationTitle;
            return this;
        }

        public Builder dateLabel(String dateLabel) {
            this.dateLabel = dateLabel;
            return this;
        }

        public Builder durationLabel(String durationLabel) {
            this.durationLabel = durationLabel;
            return this;
        }

        public Builder timeRange(String timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder topSpeciesLabel(String topSpeciesLabel) {
            this.topSpeciesLabel = topSpeciesLabel;
            return this;
        }

        public Builder newSpecies(boolean hasNewSpecies, String newSpeciesLabel) {
            this.hasNewSpecies = hasNewSpecies;
            this.newSpeciesLabel = newSpeciesLabel;
            return this;
        }

        public Builder gearLabel(String gearLabel) {
            this.gearLabel = gearLabel;
            return this;
        }

        public Builder species(List<String> species) {
            this.species = List.copyOf(species);
            return this;
        }

        public Builder locations(List<String> locations) {
            this.locations = List.copyOf(locations);
            return this;
        }

        public Builder centroid(GeoPoint centroid) {
            this.centroid = centroid;
            return this;
        }

        public Builder maxSpreadKm(double maxSpreadKm) {
            this.maxSpreadKm = maxSpreadKm;
            return this;
        }

        public Builder images(List<TripImage> images) {
            this.images = List.copyOf(images);
            return this;
        }

        public Builder mapHref(String mapHref) {
            this.mapHref = mapHref;
            return this;
        }

        public Builder startMillis(long startMillis) {
            this.startMillis = startMillis;
            return this;
        }

        public Trip build() {
            if (images.isEmpty()) {
                throw new IllegalStateException("a trip needs at least one image");
            }
            return new Trip(this);
        }
    }
}
