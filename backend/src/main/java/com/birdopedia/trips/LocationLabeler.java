package com.birdopedia.trips;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.birdopedia.model.Capture;
import com.birdopedia.model.GeoPoint;
import com.birdopedia.util.GeoMath;

/**
 * Builds the display title and the detail location list of a trip from the
 * reverse-geocoded labels of its geotagged captures.
 *
 * <p>Titles are assembled from park/site "anchors" first (at most two, each at
 * least {@code dedupMiles} from the others), then topped up with city names to
 * at most four labels. Administrative names such as "Town of Foo" or
 * "Bar County" are only shown when nothing better is available.
 */
public class LocationLabeler {

    static final int MAX_ANCHORS = 2;
    static final int MAX_TITLE_LABELS = 4;
    static final int MAX_FALLBACK_LABELS = 2;

    private static final Pattern APOSTROPHES = Pattern.compile("[\\u2018\\u2019`]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static class Result {
        private final String title;
        private final List<String> locations;

        public Result(String title, List<String> locations) {
            this.title = title;
            this.locations = locations;
        }

        public String getTitle() {
            return title;
        }

        public List<String> getLocations() {
            return locations;
        }
    }

    /** A distinct place name with the captures that carry it. */
    static class Candidate {
        final String label;
        final String normalized;
        final int count;
        final GeoPoint centroid;

        Candidate(String label, String normalized, int count, GeoPoint centroid) {
            this.label = label;
            this.normalized = normalized;
            this.count = count;
            this.centroid = centroid;
        }
    }

    private static final Comparator<Candidate> RANKING =
            Comparator.<Candidate>comparingInt(c -> c.count).reversed()
                    .thenComparing(Comparator.<Candidate>comparingInt(c -> quality(c.label)).reversed());

    private final double dedupMiles;

    public LocationLabeler(double dedupMiles) {
        this.dedupMiles = dedupMiles;
    }

    /**
     * @param geoCaptures the trip's geotagged captures
     * @param centroid    the trip centroid, used when no label is known
     */
    public Result label(List<StampedCapture> geoCaptures, GeoPoint centroid) {
        List<Capture> captures = geoCaptures.stream().map(StampedCapture::getCapture).collect(Collectors.toList());
        return new Result(title(captures, centroid), locations(captures));
    }

    String title(List<Capture> captures, GeoPoint centroid) {
        List<Candidate> parks = rank(captures, Capture::getParkOrSite, label -> false);
        List<Candidate> cities = rank(captures, Capture::getCity, LocationLabeler::isGenericAdmin);

        List<Candidate> anchors = new ArrayList<>();
        for (Candidate park : parks) {
            if (anchors.size() >= MAX_ANCHORS) {
                break;
            }
            if (anchors.isEmpty() || farFromAll(park, anchors)) {
                anchors.add(park);
            }
        }

        if (!anchors.isEmpty()) {
            List<Candidate> titleParts = new ArrayList<>(anchors);
            for (Candidate city : cities) {
                if (titleParts.size() >= MAX_TITLE_LABELS) {
                    break;
                }
                boolean duplicate = titleParts.stream().anyMatch(c -> c.normalized.equals(city.normalized));
                if (!duplicate && farFromAll(city, titleParts)) {
                    titleParts.add(city);
                }
            }
            List<String> labels = titleParts.stream().map(c -> c.label).collect(Collectors.toList());
            List<String> preferred = labels.stream().filter(l -> !isGenericAdmin(l)).collect(Collectors.toList());
            return String.join(", ", preferred.isEmpty() ? labels : preferred);
        }

        // no anchor: first cities in capture order, administrative names included
        List<String> rawCities = distinctValues(captures, Capture::getCity);
        if (!rawCities.isEmpty()) {
            return String.join(", ", rawCities.subList(0, Math.min(MAX_FALLBACK_LABELS, rawCities.size())));
        }
        List<String> freeForm = distinctValues(captures, Capture::getLocationLabel);
        if (!freeForm.isEmpty()) {
            return String.join(", ", freeForm.subList(0, Math.min(MAX_FALLBACK_LABELS, freeForm.size())));
        }
        return GeoMath.formatCoordinates(centroid.getLat(), centroid.getLon());
    }

    /**
     * Each capture's own best label, deduplicated in capture order.
     */
    List<String> locations(List<Capture> captures) {
        Set<String> locations = new LinkedHashSet<>();
        for (Capture capture : captures) {
            locations.add(bestLabel(capture));
        }
        return new ArrayList<>(locations);
    }

    static String bestLabel(Capture capture) {
        if (hasText(capture.getLocationLabel())) {
            return capture.getLocationLabel();
        }
        String joined = Stream.of(capture.getCity(), capture.getState(), capture.getCountry())
                .filter(LocationLabeler::hasText)
                .collect(Collectors.joining(", "));
        if (!joined.isEmpty()) {
            return joined;
        }
        return GeoMath.formatCoordinates(capture.getLat(), capture.getLon());
    }

    private boolean farFromAll(Candidate candidate, List<Candidate> chosen) {
        for (Candidate other : chosen) {
            if (GeoMath.haversineMiles(candidate.centroid, other.centroid) < dedupMiles) {
                return false;
            }
        }
        return true;
    }

    /**
     * Groups captures by normalized label, keeping the best-quality spelling of
     * each, and ranks the groups by (count desc, quality desc). Full ties keep
     * first-appearance order.
     */
    static List<Candidate> rank(List<Capture> captures, Function<Capture, String> labelOf, Predicate<String> exclude) {
        Map<String, String> bestLabel = new LinkedHashMap<>();
        Map<String, List<GeoPoint>> points = new LinkedHashMap<>();
        for (Capture capture : captures) {
            String raw = labelOf.apply(capture);
            String value = raw == null ? "" : raw.trim();
            String key = normalize(value);
            if (key.isEmpty() || exclude.test(value)) {
                continue;
            }
            points.computeIfAbsent(key, k -> new ArrayList<>()).add(new GeoPoint(capture.getLat(), capture.getLon()));
            String current = bestLabel.get(key);
            if (current == null || quality(value) > quality(current)) {
                bestLabel.put(key, value);
            }
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, List<GeoPoint>> entry : points.entrySet()) {
            List<GeoPoint> members = entry.getValue();
            candidates.add(new Candidate(bestLabel.get(entry.getKey()), entry.getKey(), members.size(),
                    GeoMath.centroid(members)));
        }
        candidates.sort(RANKING);
        return candidates;
    }

    private static List<String> distinctValues(List<Capture> captures, Function<Capture, String> valueOf) {
        Set<String> values = new LinkedHashSet<>();
        for (Capture capture : captures) {
            String value = valueOf.apply(capture);
            if (hasText(value)) {
                values.add(value.trim());
            }
        }
        return new ArrayList<>(values);
    }

    /**
     * Comparison form of a place label: unified apostrophes, single spaces, lower case.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String unified = APOSTROPHES.matcher(value).replaceAll("'");
        return WHITESPACE.matcher(unified).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Prefers fuller, properly capitalized spellings: ten points per capital plus length.
     */
    public static int quality(String value) {
        if (value == null) {
            return 0;
        }
        int upper = 0;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch >= 'A' && ch <= 'Z') {
                upper++;
            }
        }
        return upper * 10 + value.length();
    }

    public static boolean isGenericAdmin(String value) {
        String token = normalize(value);
        return token.startsWith("town of ")
                || token.startsWith("city of ")
                || token.endsWith(" county")
                || token.endsWith(" township");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
