package com.ili.analysis.clustering;

import java.util.List;

/**
 * Labelled anomalies, in input order, and per-cluster aggregates ordered by cluster id.
 */
public record ClusteringResult(List<ClusteredAnomaly> anomalies, List<ClusterMetrics> clusters) {

    public ClusteringResult {
        anomalies = List.copyOf(anomalies);
        clusters = List.copyOf(clusters);
    }

    public static ClusteringResult empty() {
        return new ClusteringResult(List.of(), List.of());
    }

    public int clusterCount() {
        return clusters.size();
    }

    public long noiseCount() {
        return anomalies.stream().filter(ClusteredAnomaly::isNoise).count();
    }
}
