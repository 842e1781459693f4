package com.ili.analysis.clustering;

import com.ili.analysis.growth.PairGrowth;
import com.ili.analysis.matching.MatchedPair;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups spatially close matched anomalies into interaction zones with DBSCAN.
 *
 * <p>{@code minSamples} counts the point itself, as is usual for DBSCAN; a point is a core point
 * when at least {@code minSamples} points (itself included) lie within {@code epsilon}. In
 * {@link ClusteringMode#TWO_D} the clock position is mapped to {@code clock / 360 * epsilon}, so a
 * full turn spans one neighbourhood radius; a missing clock counts as 180 degrees.</p>
 */
public class AnomalyClusterer {
    private static final Logger log = LoggerFactory.getLogger(AnomalyClusterer.class);

    public static final double DEFAULT_EPSILON_FT = 50.0;
    public static final int DEFAULT_MIN_SAMPLES = 2;
    private static final double MISSING_CLOCK_DEG = 180.0;

    private final double epsilon;
    private final ClusteringMode mode;
    private final int minSamples;

    public AnomalyClusterer() {
        this(DEFAULT_EPSILON_FT, ClusteringMode.ONE_D, DEFAULT_MIN_SAMPLES);
    }

    public AnomalyClusterer(double epsilon, ClusteringMode mode, int minSamples) {
        if (!(epsilon > 0)) {
            throw new IllegalArgumentException("epsilon must be positive, got " + epsilon);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
        this.epsilon = epsilon;
        this.mode = Objects.requireNonNull(mode, "mode is required");
        this.minSamples = minSamples;
    }

    /**
     * Labels every row and aggregates the clusters.
     */
    public ClusteringResult cluster(List<PairGrowth> rows) {
        if (rows.isEmpty()) {
            return ClusteringResult.empty();
        }

        List<AnomalyPoint> points = new ArrayList<>(rows.size());
        for (PairGrowth row : rows) {
            points.add(new AnomalyPoint(row, coordinates(row.pair())));
        }

        DBSCANClusterer<AnomalyPoint> dbscan = new DBSCANClusterer<>(epsilon, minSamples - 1);
        List<Cluster<AnomalyPoint>> clusters = dbscan.cluster(points);

        Map<AnomalyPoint, Integer> labels = new IdentityHashMap<>();
        for (int id = 0; id < clusters.size(); id++) {
            for (AnomalyPoint p : clusters.get(id).getPoints()) {
                labels.put(p, id);
            }
        }

        List<ClusteredAnomaly> labelled = new ArrayList<>(points.size());
        for (AnomalyPoint p : points) {
            labelled.add(new ClusteredAnomaly(p.row, labels.getOrDefault(p, ClusteredAnomaly.NOISE)));
        }

        List<ClusterMetrics> metrics = new ArrayList<>(clusters.size());
        for (int id = 0; id < clusters.size(); id++) {
            metrics.add(metrics(id, clusters.get(id).getPoints()));
        }

        ClusteringResult result = new ClusteringResult(labelled, metrics);
        log.info("clustering.completed mode={} epsilon={} clusters={} unclustered={}",
                mode, epsilon, result.clusterCount(), result.noiseCount());
        return result;
    }

    private double[] coordinates(MatchedPair pair) {
        if (mode == ClusteringMode.TWO_D) {
            double clock = pair.clockDegA() != null ? pair.clockDegA() : MISSING_CLOCK_DEG;
            return new double[]{pair.distanceA(), clock / 360.0 * epsilon};
        }
        return new double[]{pair.distanceA()};
    }

    private static ClusterMetrics metrics(int clusterId, List<AnomalyPoint> members) {
        DescriptiveStatistics distance = new DescriptiveStatistics();
        DescriptiveStatistics depth = new DescriptiveStatistics();
        DescriptiveStatistics growth = new DescriptiveStatistics();
        double area = 0.0;
        for (AnomalyPoint p : members) {
            MatchedPair pair = p.row.pair();
            distance.addValue(pair.distanceA());
            if (pair.depthB() != null) {
                depth.addValue(pair.depthB());
            }
            if (p.row.depthGrowthRate() != null) {
                growth.addValue(p.row.depthGrowthRate());
            }
            double length = pair.lengthB() != null ? pair.lengthB() : 0.0;
            double width = pair.widthB() != null ? pair.widthB() : 0.0;
            area += length * width;
        }
        return new ClusterMetrics(clusterId, members.size(),
                round(distance.getMean()),
                round(distance.getMax() - distance.getMin()),
                depth.getN() > 0 ? round(depth.getMean()) : null,
                round(area),
                growth.getN() > 0 ? round(growth.getMean()) : null);
    }

    private static double round(double value) {
        return Math.round(value * 1e4) / 1e4;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public ClusteringMode getMode() {
        return mode;
    }

    public int getMinSamples() {
        return minSamples;
    }

    private static final class AnomalyPoint implements Clusterable {
        private final PairGrowth row;
        private final double[] point;

        private AnomalyPoint(PairGrowth row, double[] point) {
            this.row = row;
            this.point = point;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
