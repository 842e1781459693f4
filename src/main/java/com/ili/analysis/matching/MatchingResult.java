package com.ili.analysis.matching;

import java.util.List;

/**
 * Output of anomaly matching between two aligned surveys.
 *
 * @param matched      accepted pairs
 * @param missing      Run-A anomalies without a partner
 * @param added        Run-B anomalies without a partner
 * @param segmentCount number of segments the line was divided into
 */
public record MatchingResult(
        List<MatchedPair> matched,
        List<UnmatchedFeature> missing,
        List<UnmatchedFeature> added,
        int segmentCount
) {
    public MatchingResult {
        matched = List.copyOf(matched);
        missing = List.copyOf(missing);
        added = List.copyOf(added);
    }

    public long confidentCount() {
        return matched.stream().filter(p -> !p.isUncertain()).count();
    }

    public long uncertainCount() {
        return matched.stream().filter(MatchedPair::isUncertain).count();
    }
}
