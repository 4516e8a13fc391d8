package com.birdopedia.trips;

/**
 * How a day's non-geotagged captures are attached to that day's geo-clusters.
 */
public enum ExtraCapturePolicy {
    /** Every cluster of the day receives every extra capture of the day. */
    ATTACH_TO_ALL,
    /** Each extra capture joins only the day's largest cluster. */
    LARGEST_CLUSTER
}
