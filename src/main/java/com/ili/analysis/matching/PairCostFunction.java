package com.ili.analysis.matching;

import com.ili.analysis.core.model.FeatureRecord;
import com.ili.analysis.rules.ClockPositions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Gates and costs a candidate anomaly pair.
 *
 * <p>Hard gates (pair infeasible):</p>
 * <ul>
 *   <li>orientations both known and different</li>
 *   <li>categories not compatible</li>
 *   <li>aligned distance difference above the distance tolerance</li>
 *   <li>clock difference above the clock tolerance, when both clocks are known</li>
 * </ul>
 *
 * <p>Cost of a feasible pair (lower is better):</p>
 * <pre>
 * cost = wDist*dDistance + wClock*dClock + wDepth*dDepth + wSize*(dLength + dWidth) + typePenalty
 * </pre>
 * <p>A term whose inputs are missing on either side contributes 0.
 * {@code typePenalty} applies only when compatible categories differ.</p>
 */
public class PairCostFunction {
    private static final Logger log = LoggerFactory.getLogger(PairCostFunction.class);

    private final MatchingCriteria criteria;

    public PairCostFunction(MatchingCriteria criteria) {
        this.criteria = criteria;
    }

    /**
     * Distance and clock gates. Run B is compared by its aligned distance.
     */
    public boolean withinTolerance(FeatureRecord a, FeatureRecord b) {
        if (Math.abs(a.distance() - b.alignedDistance()) > criteria.distanceToleranceFt()) {
            return false;
        }
        Double clockDiff = ClockPositions.angularDistance(a.clockDeg(), b.clockDeg());
        return clockDiff == null || clockDiff <= criteria.clockToleranceDeg();
    }

    /**
     * Orientation and category gates.
     */
    public boolean attributesCompatible(FeatureRecord a, FeatureRecord b) {
        if (a.orientation().isKnown() && b.orientation().isKnown() && a.orientation() != b.orientation()) {
            return false;
        }
        return criteria.compatibility().compatible(a.category(), b.category());
    }

    /**
     * Computes the cost of a pair.
     *
     * @return the non-negative cost, or empty when any hard gate rejects the pair
     */
    public OptionalDouble cost(FeatureRecord a, FeatureRecord b) {
        if (!withinTolerance(a, b) || !attributesCompatible(a, b)) {
            return OptionalDouble.empty();
        }
        CostWeights w = criteria.weights();

        double deltaDistance = Math.abs(a.distance() - b.alignedDistance());
        Double deltaClock = ClockPositions.angularDistance(a.clockDeg(), b.clockDeg());
        double deltaDepth = absDiff(a.depthPct(), b.depthPct());
        double deltaSize = absDiff(a.lengthIn(), b.lengthIn()) + absDiff(a.widthIn(), b.widthIn());
        double typePenalty = a.category() == b.category() ? 0.0 : w.typePenalty();

        double cost = w.distanceWeight() * deltaDistance
                + w.clockWeight() * (deltaClock != null ? deltaClock : 0.0)
                + w.depthWeight() * deltaDepth
                + w.sizeWeight() * deltaSize
                + typePenalty;

        if (Double.isNaN(cost)) {
            return OptionalDouble.empty();
        }
        if (log.isTraceEnabled()) {
            log.trace("Cost {} -> {}: dDist={} dClock={} dDepth={} dSize={} penalty={} total={}",
                    a.featureId(), b.featureId(), deltaDistance, deltaClock, deltaDepth, deltaSize, typePenalty, cost);
        }
        return OptionalDouble.of(cost);
    }

    public MatchingCriteria getCriteria() {
        return criteria;
    }

    private static double absDiff(Double x, Double y) {
        if (x == null || y == null || x.isNaN() || y.isNaN()) {
            return 0.0;
        }
        return Math.abs(x - y);
    }
}
