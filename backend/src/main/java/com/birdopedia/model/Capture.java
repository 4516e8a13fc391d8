package com.birdopedia.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.birdopedia.util.GeoMath;

/**
 * One photographic observation of a species, as produced by the metadata
 * extraction stage. Place labels come from the reverse-geocode cache.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Capture {
    @JsonProperty("bird")
    private String species;
    private String src;
    private String thumbSrc;
    private String speciesHref;
    private String filename;
    private String captureDateIso;

    private Double lat;
    private Double lon;

    private String camera;
    private String lens;
    private String exposure;
    private String aperture;
    private String iso;

    // Reverse-geocode labels
    private String park;
    private String site;
    private String city;
    private String state;
    private String country;
    private String locationLabel;

    public Capture() {
    }

    public Capture(String species, String filename, String captureDateIso, Double lat, Double lon) {
        this.species = species;
        this.filename = filename;
        this.captureDateIso = captureDateIso;
        this.lat = lat;
        this.lon = lon;
    }

    public String getSpecies() {
        return species;
    }

    public void setSpecies(String species) {
        this.species = species;
    }

    public String getSrc() {
        return src;
    }

    public void setSrc(String src) {
        this.src = src;
    }

    public String getThumbSrc() {
        return thumbSrc;
    }

    public void setThumbSrc(String thumbSrc) {
        this.thumbSrc = thumbSrc;
    }

    public String getSpeciesHref() {
        return speciesHref;
    }

    public void setSpeciesHref(String speciesHref) {
        this.speciesHref = speciesHref;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getCaptureDateIso() {
        return captureDateIso;
    }

    public void setCaptureDateIso(String captureDateIso) {
        this.captureDateIso = captureDateIso;
    }

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLon() {
        return lon;
    }

    public void setLon(Double lon) {
        this.lon = lon;
    }

    public String getCamera() {
        return camera;
    }

    public void setCamera(String camera) {
        this.camera = camera;
    }

    public String getLens() {
        return lens;
    }

    public void setLens(String lens) {
        this.lens = lens;
    }

    public String getExposure() {
        return exposure;
    }

    public void setExposure(String exposure) {
        this.exposure = exposure;
    }

    public String getAperture() {
        return aperture;
    }

    public void setAperture(String aperture) {
        this.aperture = aperture;
    }

    public String getIso() {
        return iso;
    }

    public void setIso(String iso) {
        this.iso = iso;
    }

    public String getPark() {
        return park;
    }

    public void setPark(String park) {
        this.park = park;
    }

    public String getSite() {
        return site;
    }

    public void setSite(String site) {
        this.site = site;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getLocationLabel() {
        return locationLabel;
    }

    public void setLocationLabel(String locationLabel) {
        this.locationLabel = locationLabel;
    }

    /**
     * Check if this capture carries finite, in-range coordinates
     */
    @JsonIgnore
    public boolean isGeotagged() {
        return lat != null && lon != null && GeoMath.isValidCoordinate(lat, lon);
    }

    /**
     * Park name when present, otherwise the site name; blank when neither is set.
     */
    @JsonIgnore
    public String getParkOrSite() {
        if (park != null && !park.isBlank()) return park.trim();
        if (site != null && !site.isBlank()) return site.trim();
        return "";
    }

    /**
     * Composite identity used when merging non-geotagged captures into a trip.
     */
    @JsonIgnore
    public String getMergeKey() {
        return species + "::" + filename;
    }

    @JsonIgnore
    public boolean hasPlaceLabels() {
        return hasText(park) || hasText(site) || hasText(city) || hasText(state)
                || hasText(country) || hasText(locationLabel);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return species + "/" + filename + " @ " + captureDateIso;
    }
}
