package com.birdopedia.config;

import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.birdopedia.archive.CaptureManifestLoader;
import com.birdopedia.archive.TripWriter;
import com.birdopedia.trips.TripEngine;
import com.birdopedia.trips.TripSettings;

@Configuration
public class TripEngineConfig {

    @Bean
    public TripSettings tripSettings(AppProperties appProperties) {
        AppProperties.Trips trips = appProperties.getTrips();
        ZoneId zone = StringUtils.hasText(trips.getDefaultZone())
                ? ZoneId.of(trips.getDefaultZone().trim())
                : ZoneId.systemDefault();
        return new TripSettings(
                trips.getClusterRadiusKm(),
                trips.getTitleDedupMiles(),
                zone,
                trips.getExtraCapturePolicy(),
                trips.isParallelDays(),
                appProperties.getSite().getBasePath());
    }

    @Bean
    public TripEngine tripEngine(TripSettings tripSettings) {
        return new TripEngine(tripSettings);
    }

    @Bean
    public CaptureManifestLoader captureManifestLoader(ObjectMapper objectMapper) {
        return new CaptureManifestLoader(objectMapper);
    }

    @Bean
    public TripWriter tripWriter(ObjectMapper objectMapper) {
        return new TripWriter(objectMapper);
    }
}
