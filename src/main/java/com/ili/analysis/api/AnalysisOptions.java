package com.ili.analysis.api;

import com.ili.analysis.clustering.ClusteringMode;
import com.ili.analysis.core.model.FeatureCategory;
import com.ili.analysis.growth.model.InformationCriterion;
import com.ili.analysis.matching.CategoryCompatibility;
import com.ili.analysis.matching.CostWeights;
import com.ili.analysis.matching.MatchingCriteria;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Options for an analysis run.
 * Configures matching tolerances, growth thresholds, clustering and model selection.
 */
public class AnalysisOptions {

    private static final double DEFAULT_DIST_TOL_FT = 10.0;
    private static final double DEFAULT_CLOCK_TOL_DEG = 15.0;
    private static final double DEFAULT_COST_THRESHOLD = 15.0;
    private static final double DEFAULT_CRITICAL_DEPTH_PCT = 80.0;
    private static final double DEFAULT_FORECAST_YEARS = 5.0;
    private static final int DEFAULT_CLUSTERING_MIN_SAMPLES = 2;
    private static final double DEFAULT_ACCELERATION_THRESHOLD_PCT = 50.0;

    private final double distTolFt;
    private final double clockTolDeg;
    private final double costThreshold;
    private final double criticalDepthPct;
    private final double forecastYears;
    private final CostWeights costWeights;
    private final Double clusteringEpsilon;
    private final ClusteringMode clusteringMode;
    private final int clusteringMinSamples;
    private final InformationCriterion informationCriterion;
    private final double accelerationThresholdPct;
    private final Map<FeatureCategory, Set<FeatureCategory>> compatibleCategories;

    private AnalysisOptions(Builder builder) {
        this.distTolFt = builder.distTolFt;
        this.clockTolDeg = builder.clockTolDeg;
        this.costThreshold = builder.costThreshold;
        this.criticalDepthPct = builder.criticalDepthPct;
        this.forecastYears = builder.forecastYears;
        this.costWeights = builder.costWeights;
        this.clusteringEpsilon = builder.clusteringEpsilon;
        this.clusteringMode = builder.clusteringMode;
        this.clusteringMinSamples = builder.clusteringMinSamples;
        this.informationCriterion = builder.informationCriterion;
        this.accelerationThresholdPct = builder.accelerationThresholdPct;
        Map<FeatureCategory, Set<FeatureCategory>> copy = new EnumMap<>(FeatureCategory.class);
        builder.compatibleCategories.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        this.compatibleCategories = Map.copyOf(copy);
    }

    public double getDistTolFt() {
        return distTolFt;
    }

    public double getClockTolDeg() {
        return clockTolDeg;
    }

    public double getCostThreshold() {
        return costThreshold;
    }

    public double getCriticalDepthPct() {
        return criticalDepthPct;
    }

    public double getForecastYears() {
        return forecastYears;
    }

    public CostWeights getCostWeights() {
        return costWeights;
    }

    /**
     * Clustering radius; empty disables clustering.
     */
    public OptionalDouble getClusteringEpsilon() {
        return clusteringEpsilon != null ? OptionalDouble.of(clusteringEpsilon) : OptionalDouble.empty();
    }

    public boolean isClusteringEnabled() {
        return clusteringEpsilon != null;
    }

    public ClusteringMode getClusteringMode() {
        return clusteringMode;
    }

    public int getClusteringMinSamples() {
        return clusteringMinSamples;
    }

    public InformationCriterion getInformationCriterion() {
        return informationCriterion;
    }

    public double getAccelerationThresholdPct() {
        return accelerationThresholdPct;
    }

    public Map<FeatureCategory, Set<FeatureCategory>> getCompatibleCategories() {
        return compatibleCategories;
    }

    /**
     * Matching settings derived from these options.
     */
    public MatchingCriteria toMatchingCriteria() {
        CategoryCompatibility compatibility = compatibleCategories.isEmpty()
                ? CategoryCompatibility.identityOnly()
                : CategoryCompatibility.of(compatibleCategories);
        return new MatchingCriteria(distTolFt, clockTolDeg, costThreshold, costWeights, compatibility);
    }

    /**
     * Creates default options.
     */
    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double distTolFt = DEFAULT_DIST_TOL_FT;
        private double clockTolDeg = DEFAULT_CLOCK_TOL_DEG;
        private double costThreshold = DEFAULT_COST_THRESHOLD;
        private double criticalDepthPct = DEFAULT_CRITICAL_DEPTH_PCT;
        private double forecastYears = DEFAULT_FORECAST_YEARS;
        private CostWeights costWeights = CostWeights.defaultWeights();
        private Double clusteringEpsilon;
        private ClusteringMode clusteringMode = ClusteringMode.ONE_D;
        private int clusteringMinSamples = DEFAULT_CLUSTERING_MIN_SAMPLES;
        private InformationCriterion informationCriterion = InformationCriterion.BIC;
        private double accelerationThresholdPct = DEFAULT_ACCELERATION_THRESHOLD_PCT;
        private final Map<FeatureCategory, Set<FeatureCategory>> compatibleCategories = new EnumMap<>(FeatureCategory.class);

        public Builder distTolFt(double distTolFt) {
            validateNonNegative(distTolFt, "distTolFt");
            this.distTolFt = distTolFt;
            return this;
        }

        public Builder clockTolDeg(double clockTolDeg) {
            validateNonNegative(clockTolDeg, "clockTolDeg");
            this.clockTolDeg = clockTolDeg;
            return this;
        }

        public Builder costThreshold(double costThreshold) {
            validateNonNegative(costThreshold, "costThreshold");
            this.costThreshold = costThreshold;
            return this;
        }

        public Builder criticalDepthPct(double criticalDepthPct) {
            if (!(criticalDepthPct > 0)) {
                throw new IllegalArgumentException("criticalDepthPct must be positive");
            }
            this.criticalDepthPct = criticalDepthPct;
            return this;
        }

        public Builder forecastYears(double forecastYears) {
            if (!(forecastYears > 0)) {
                throw new IllegalArgumentException("forecastYears must be positive");
            }
            this.forecastYears = forecastYears;
            return this;
        }

        public Builder costWeights(CostWeights costWeights) {
            this.costWeights = Objects.requireNonNull(costWeights, "costWeights is required");
            return this;
        }

        /**
         * Enables clustering with the given neighbourhood radius.
         */
        public Builder clusteringEpsilon(double clusteringEpsilon) {
            if (!(clusteringEpsilon > 0)) {
                throw new IllegalArgumentException("clusteringEpsilon must be positive");
            }
            this.clusteringEpsilon = clusteringEpsilon;
            return this;
        }

        public Builder clusteringMode(ClusteringMode clusteringMode) {
            this.clusteringMode = Objects.requireNonNull(clusteringMode, "clusteringMode is required");
            return this;
        }

        public Builder clusteringMinSamples(int clusteringMinSamples) {
            if (clusteringMinSamples < 1) {
                throw new IllegalArgumentException("clusteringMinSamples must be at least 1");
            }
            this.clusteringMinSamples = clusteringMinSamples;
            return this;
        }

        public Builder informationCriterion(InformationCriterion informationCriterion) {
            this.informationCriterion = Objects.requireNonNull(informationCriterion, "informationCriterion is required");
            return this;
        }

        public Builder accelerationThresholdPct(double accelerationThresholdPct) {
            validateNonNegative(accelerationThresholdPct, "accelerationThresholdPct");
            this.accelerationThresholdPct = accelerationThresholdPct;
            return this;
        }

        /**
         * Allows two categories to be matched to each other (symmetric).
         */
        public Builder compatibleCategories(FeatureCategory a, FeatureCategory b) {
            compatibleCategories.computeIfAbsent(a, k -> EnumSet.noneOf(FeatureCategory.class)).add(b);
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }

        private void validateNonNegative(double value, String name) {
            if (!(value >= 0.0)) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
        }
    }
}
