package com.birdopedia.trips;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Attaches a day's non-geotagged captures to that day's geo-clusters.
 *
 * <p>Under {@link ExtraCapturePolicy#ATTACH_TO_ALL} a single non-geotagged photo
 * appears in every trip of its day. {@link ExtraCapturePolicy#LARGEST_CLUSTER}
 * gives it to the cluster with the most geotagged captures instead, the earliest
 * cluster winning ties.
 */
public class CaptureMerger {

    private final ExtraCapturePolicy policy;

    public CaptureMerger(ExtraCapturePolicy policy) {
        this.policy = policy;
    }

    /**
     * @param clusters the day's clusters in discovery order
     * @param extras   the same day's non-geotagged captures
     */
    public List<MergedCluster> merge(List<GeoCluster> clusters, List<StampedCapture> extras) {
        List<MergedCluster> merged = new ArrayList<>(clusters.size());
        GeoCluster receiver = policy == ExtraCapturePolicy.LARGEST_CLUSTER ? largest(clusters) : null;
        for (GeoCluster cluster : clusters) {
            boolean receives = policy == ExtraCapturePolicy.ATTACH_TO_ALL || cluster == receiver;
            merged.add(new MergedCluster(cluster, receives ? attach(cluster, extras) : cluster.getCaptures()));
        }
        return merged;
    }

    private List<StampedCapture> attach(GeoCluster cluster, List<StampedCapture> extras) {
        List<StampedCapture> captures = new ArrayList<>(cluster.getCaptures());
        Set<String> seen = new HashSet<>();
        for (StampedCapture sc : captures) {
            seen.add(sc.getCapture().getMergeKey());
        }
        for (StampedCapture extra : extras) {
            if (seen.add(extra.getCapture().getMergeKey())) {
                captures.add(extra);
            }
        }
        captures.sort(StampedCapture.CHRONOLOGICAL);
        return captures;
    }

    private static GeoCluster largest(List<GeoCluster> clusters) {
        GeoCluster best = null;
        for (GeoCluster cluster : clusters) {
            if (best == null || cluster.size() > best.size()) {
                best = cluster;
            }
        }
        return best;
    }
}
