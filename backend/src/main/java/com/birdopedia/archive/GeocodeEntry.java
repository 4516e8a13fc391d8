package com.birdopedia.archive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One reverse-geocoded point of {@code geocode.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeocodeEntry {
    private String key;
    private Double lat;
    private Double lon;
    private String label;
    private String park;
    private String site;
    private String city;
    private String state;
    private String country;

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
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

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
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
}
