package com.birdopedia.trips;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.birdopedia.model.GeoPoint;
import com.birdopedia.util.GeoMath;

/**
 * Splits one day's geotagged captures into connected components of the
 * "within radius" graph: two captures share a cluster iff a chain of captures,
 * each hop at most {@code radiusKm} long, links them.
 *
 * <p>Every pair is compared, so membership never depends on a seed point or on
 * traversal order.
 */
public class SpatialClusterer {

    private final double radiusKm;

    public SpatialClusterer(double radiusKm) {
        if (!(radiusKm > 0)) {
            throw new IllegalArgumentException("radiusKm must be positive");
        }
        this.radiusKm = radiusKm;
    }

    /**
     * @param dayKey   day shared by all captures
     * @param captures geotagged captures of that day, sorted ascending by time
     * @return clusters ordered by their earliest member
     */
    public List<GeoCluster> cluster(String dayKey, List<StampedCapture> captures) {
        int n = captures.size();
        if (n == 0) {
            return Collections.emptyList();
        }
        GeoPoint[] points = new GeoPoint[n];
        for (int i = 0; i < n; i++) {
            points[i] = captures.get(i).getPoint();
        }

        boolean[] visited = new boolean[n];
        List<GeoCluster> clusters = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (visited[start]) {
                continue;
            }
            List<Integer> component = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int index = queue.poll();
                component.add(index);
                for (int j = 0; j < n; j++) {
                    if (visited[j]) {
                        continue;
                    }
                    if (GeoMath.haversineKm(points[index], points[j]) <= radiusKm) {
                        visited[j] = true;
                        queue.add(j);
                    }
                }
            }
            clusters.add(toCluster(dayKey, captures, points, component));
        }
        return clusters;
    }

    private GeoCluster toCluster(String dayKey, List<StampedCapture> captures, GeoPoint[] points, List<Integer> component) {
        // input is chronological, so index order is time order
        Collections.sort(component);
        List<StampedCapture> members = new ArrayList<>(component.size());
        List<GeoPoint> memberPoints = new ArrayList<>(component.size());
        for (int index : component) {
            members.add(captures.get(index));
            memberPoints.add(points[index]);
        }
        GeoPoint centroid = GeoMath.centroid(memberPoints);
        double spread = GeoMath.maxDistanceKm(centroid, memberPoints);
        return new GeoCluster(dayKey, members, centroid, spread);
    }
}
