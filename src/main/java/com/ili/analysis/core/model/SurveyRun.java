package com.ili.analysis.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One in-line inspection survey: a run identifier plus its validated feature table.
 */
public record SurveyRun(String runId, List<FeatureRecord> features) {

    public SurveyRun {
        Objects.requireNonNull(runId, "runId is required");
        features = features != null ? List.copyOf(features) : List.of();
    }

    public int size() {
        return features.size();
    }
}
