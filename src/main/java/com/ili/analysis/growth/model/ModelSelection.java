package com.ili.analysis.growth.model;

import java.util.List;
import java.util.Objects;

/**
 * The selected model and every candidate that fitted successfully.
 */
public record ModelSelection(ModelFit best, List<ModelFit> allFits, InformationCriterion criterion) {

    public ModelSelection {
        Objects.requireNonNull(best, "best is required");
        allFits = List.copyOf(allFits);
    }
}
