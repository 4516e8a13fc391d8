package com.birdopedia.trips;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.web.util.UriUtils;

import com.birdopedia.model.Capture;
import com.birdopedia.util.Tally;

/**
 * Computes the descriptive facts of a trip from its merged, time-sorted captures.
 */
public class TripSummarizer {

    static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);
    static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm", Locale.US);

    private static final String UNKNOWN = "Unknown";
    private static final Predicate<String> KNOWN_GEAR =
            value -> value != null && !value.isBlank() && !UNKNOWN.equalsIgnoreCase(value.trim());

    private final String siteBasePath;

    public TripSummarizer(String siteBasePath) {
        this.siteBasePath = siteBasePath;
    }

    /**
     * @param merged                cluster plus attached captures
     * @param labels                title and location list for the cluster
     * @param firstSeenDayBySpecies earliest day key per species across the whole archive
     * @return the trip, still without its final id
     */
    public Trip summarize(MergedCluster merged, LocationLabeler.Result labels, Map<String, String> firstSeenDayBySpecies) {
        List<StampedCapture> captures = merged.getCaptures();
        StampedCapture first = captures.get(0);
        StampedCapture last = captures.get(captures.size() - 1);
        String dayKey = merged.getDayKey();

        List<Capture> raw = captures.stream().map(StampedCapture::getCapture).collect(Collectors.toList());
        List<String> species = distinctSpecies(raw);

        String topSpeciesLabel = Tally.top(raw, Capture::getSpecies)
                .map(Tally.Entry::toString)
                .orElse(UNKNOWN);

        List<String> newSpecies = species.stream()
                .filter(name -> dayKey.equals(firstSeenDayBySpecies.get(name)))
                .collect(Collectors.toList());

        String camera = Tally.top(raw, Capture::getCamera, KNOWN_GEAR).map(Tally.Entry::getValue).orElse("Unknown camera");
        String lens = Tally.top(raw, Capture::getLens, KNOWN_GEAR).map(Tally.Entry::getValue).orElse("Unknown lens");

        List<TripImage> images = new ArrayList<>(captures.size());
        for (StampedCapture sc : captures) {
            images.add(toImage(sc));
        }
        TripImage cover = images.get(images.size() - 1);

        return Trip.builder()
                .dayKey(dayKey)
                .locationTitle(labels.getTitle())
                .locations(labels.getLocations())
                .dateLabel(first.getCapturedAt().format(DATE_LABEL))
                .timeRange(timeRange(first.getCapturedAt(), last.getCapturedAt()))
                .durationLabel(formatDuration(minutesBetween(first, last)))
                .species(species)
                .topSpeciesLabel(topSpeciesLabel)
                .newSpecies(!newSpecies.isEmpty(), newSpecies.isEmpty() ? "None" : String.join(", ", newSpecies))
                .gearLabel(camera + " + " + lens)
                .centroid(merged.getCluster().getCentroid())
                .maxSpreadKm(merged.getCluster().getMaxSpreadKm())
                .images(images)
                .mapHref(mapHref(cover.getBird(), cover.getFilename()))
                .startMillis(first.getInstantMillis())
                .build();
    }

    static List<String> distinctSpecies(List<Capture> captures) {
        return captures.stream()
                .map(Capture::getSpecies)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(Tally.ALPHABETICAL)
                .collect(Collectors.toList());
    }

    static long minutesBetween(StampedCapture first, StampedCapture last) {
        long millis = last.getInstantMillis() - first.getInstantMillis();
        return Math.max(0, Math.round(millis / 60000.0));
    }

    /**
     * {@code "1h 30m"}, {@code "2h"}, {@code "45m"}; anything not positive is {@code "0m"}.
     */
    public static String formatDuration(long totalMinutes) {
        if (totalMinutes <= 0) {
            return "0m";
        }
        Duration duration = Duration.ofMinutes(totalMinutes);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        if (hours == 0) {
            return minutes + "m";
        }
        if (minutes == 0) {
            return hours + "h";
        }
        return hours + "h " + minutes + "m";
    }

    static String timeRange(ZonedDateTime start, ZonedDateTime end) {
        return start.format(CLOCK) + "\u2013" + end.format(CLOCK);
    }

    String mapHref(String species, String filename) {
        return siteBasePath + "/map/index.html?species=" + encode(species)
                + "&focus=all&image=" + encode(filename);
    }

    String speciesHref(String species) {
        return siteBasePath + "/" + encode(species) + "/index.html";
    }

    private TripImage toImage(StampedCapture sc) {
        Capture c = sc.getCapture();
        String src = c.getSrc();
        String thumb = c.getThumbSrc() != null ? c.getThumbSrc() : src;
        String href = c.getSpeciesHref() != null ? c.getSpeciesHref() : speciesHref(c.getSpecies());
        return new TripImage(src, thumb, c.getSpecies(), href, c.getFilename(),
                sc.getCapturedAt().format(DATE_LABEL), c.getCaptureDateIso(),
                c.isGeotagged() ? c.getLat() : null,
                c.isGeotagged() ? c.getLon() : null);
    }

    private static String encode(String value) {
        return UriUtils.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
