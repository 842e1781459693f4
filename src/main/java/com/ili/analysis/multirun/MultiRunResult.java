package com.ili.analysis.multirun;

import com.ili.analysis.growth.model.MultiRunGrowthResult;

import java.util.List;

/**
 * Output of a multi-survey tracking run.
 *
 * @param runIds      surveys in chronological order
 * @param times       years since the first survey, one per run
 * @param steps       alignment and matching of each consecutive pair
 * @param tracks      chained anomaly tracks
 * @param trackGrowth growth-model analysis of the tracks observed with a depth in every survey;
 *                    empty for fewer than three surveys
 */
public record MultiRunResult(
        List<String> runIds,
        double[] times,
        List<PairwiseStep> steps,
        List<AnomalyTrack> tracks,
        List<MultiRunGrowthResult> trackGrowth
) {
    public MultiRunResult {
        runIds = List.copyOf(runIds);
        times = times.clone();
        steps = List.copyOf(steps);
        tracks = List.copyOf(tracks);
        trackGrowth = List.copyOf(trackGrowth);
    }

    @Override
    public double[] times() {
        return times.clone();
    }

    public long acceleratingCount() {
        return trackGrowth.stream()
                .filter(g -> g.acceleration() != null && g.acceleration().isAccelerating())
                .count();
    }
}
