package com.birdopedia.trips;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.birdopedia.model.Capture;

/**
 * Turns a flat capture list into ranked trips:
 * <ol>
 *   <li>bucket geotagged captures by local day,</li>
 *   <li>split each day into proximity clusters,</li>
 *   <li>attach the day's non-geotagged captures,</li>
 *   <li>label and summarize each cluster,</li>
 *   <li>rank and number the trips.</li>
 * </ol>
 * Pure and stateless apart from its settings; safe to share between threads.
 */
public class TripEngine {

    private static final Logger log = LoggerFactory.getLogger(TripEngine.class);

    private final TripSettings settings;
    private final DayPartitioner partitioner;
    private final SpatialClusterer clusterer;
    private final CaptureMerger merger;
    private final LocationLabeler labeler;
    private final TripSummarizer summarizer;
    private final TripRanker ranker;

    public TripEngine(TripSettings settings) {
        this.settings = settings;
        this.partitioner = new DayPartitioner(new CaptureClock(settings.getDefaultZone()));
        this.clusterer = new SpatialClusterer(settings.getClusterRadiusKm());
        this.merger = new CaptureMerger(settings.getExtraCapturePolicy());
        this.labeler = new LocationLabeler(settings.getTitleDedupMiles());
        this.summarizer = new TripSummarizer(settings.getSiteBasePath());
        this.ranker = new TripRanker();
    }

    public TripSettings getSettings() {
        return settings;
    }

    /**
     * @param captures              every capture of the archive, geotagged or not
     * @param firstSeenDayBySpecies earliest day key per species across the archive
     */
    public TripBatch build(List<Capture> captures, Map<String, String> firstSeenDayBySpecies) {
        if (captures == null || captures.isEmpty()) {
            return TripBatch.empty();
        }
        Map<String, String> firstSeen = firstSeenDayBySpecies != null ? firstSeenDayBySpecies : Collections.emptyMap();

        List<Capture> geotagged = new ArrayList<>();
        List<Capture> extras = new ArrayList<>();
        for (Capture capture : captures) {
            (capture.isGeotagged() ? geotagged : extras).add(capture);
        }

        DayPartitioner.Result geoDays = partitioner.partition(geotagged);
        DayPartitioner.Result extraDays = partitioner.partition(extras);
        int skipped = geoDays.getSkipped() + extraDays.getSkipped();
        if (skipped > 0) {
            log.warn("Skipped {} of {} captures with no resolvable capture time", skipped, captures.size());
        }

        int unattached = extraDays.getDays().entrySet().stream()
                .filter(e -> !geoDays.getDays().containsKey(e.getKey()))
                .mapToInt(e -> e.getValue().size())
                .sum();

        Stream<Map.Entry<String, List<StampedCapture>>> days = settings.isParallelDays()
                ? geoDays.getDays().entrySet().parallelStream()
                : geoDays.getDays().entrySet().stream();

        List<Trip> trips = days
                .flatMap(day -> buildDay(day.getKey(), day.getValue(), extraDays.getDay(day.getKey()), firstSeen).stream())
                .collect(Collectors.toList());

        List<Trip> ranked = ranker.rank(trips);
        log.info("Built {} trips over {} days from {} geotagged and {} other captures ({})",
                ranked.size(), geoDays.getDays().size(), geotagged.size(), extras.size(), settings);
        return new TripBatch(ranked, skipped, unattached);
    }

    List<Trip> buildDay(String dayKey, List<StampedCapture> geoCaptures, List<StampedCapture> extras,
                        Map<String, String> firstSeen) {
        List<GeoCluster> clusters = clusterer.cluster(dayKey, geoCaptures);
        List<MergedCluster> merged = merger.merge(clusters, extras);
        List<Trip> trips = new ArrayList<>(merged.size());
        for (MergedCluster cluster : merged) {
            LocationLabeler.Result labels = labeler.label(cluster.getCluster().getCaptures(), cluster.getCluster().getCentroid());
            trips.add(summarizer.summarize(cluster, labels, firstSeen));
        }
        log.debug("Day {}: {} geotagged captures -> {} clusters", dayKey, geoCaptures.size(), clusters.size());
        return trips;
    }
}
