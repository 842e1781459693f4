package com.ili.analysis.multirun;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One physical anomaly followed across surveys.
 * Slots are indexed by survey position; a {@code null} slot means the anomaly was not
 * observed (matched) in that survey.
 *
 * @param trackId       track identifier, unique within one multi-run analysis
 * @param runIds        survey identifiers in chronological order
 * @param featureIds    feature identifier per survey, or {@code null}
 * @param depths        depth %WT per survey, or {@code null}
 * @param firstDistance Run distance (ft) of the first observation
 */
public record AnomalyTrack(
        int trackId,
        List<String> runIds,
        List<String> featureIds,
        List<Double> depths,
        Double firstDistance
) {
    public AnomalyTrack {
        runIds = List.copyOf(runIds);
        if (featureIds.size() != runIds.size() || depths.size() != runIds.size()) {
            throw new IllegalArgumentException("featureIds and depths must have one slot per run");
        }
        featureIds = Collections.unmodifiableList(new ArrayList<>(featureIds));
        depths = Collections.unmodifiableList(new ArrayList<>(depths));
    }

    /**
     * Number of surveys in which the anomaly was matched.
     */
    public int detectionCount() {
        return (int) featureIds.stream().filter(Objects::nonNull).count();
    }

    /**
     * Position of the first survey the anomaly was observed in.
     */
    public OptionalInt firstRunIndex() {
        for (int i = 0; i < featureIds.size(); i++) {
            if (featureIds.get(i) != null) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * True when a depth was reported in every survey.
     */
    public boolean hasCompleteDepthHistory() {
        return depths.stream().allMatch(Objects::nonNull);
    }

    public String featureIdIn(int runIndex) {
        return featureIds.get(runIndex);
    }

    public Double depthIn(int runIndex) {
        return depths.get(runIndex);
    }
}
