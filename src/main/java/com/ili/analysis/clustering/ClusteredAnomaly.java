package com.ili.analysis.clustering;

import com.ili.analysis.growth.PairGrowth;

import java.util.Objects;

/**
 * A matched anomaly with its interaction-zone label; {@value #NOISE} means unclustered.
 */
public record ClusteredAnomaly(PairGrowth growth, int clusterId) {

    public static final int NOISE = -1;

    public ClusteredAnomaly {
        Objects.requireNonNull(growth, "growth is required");
        if (clusterId < NOISE) {
            throw new IllegalArgumentException("clusterId must be >= -1, got " + clusterId);
        }
    }

    public boolean isNoise() {
        return clusterId == NOISE;
    }
}
