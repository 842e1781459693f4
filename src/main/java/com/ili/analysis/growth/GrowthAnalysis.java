package com.ili.analysis.growth;

import java.util.List;

/**
 * Growth rows sorted by descending severity (the dig-list order) plus per-category statistics.
 */
public record GrowthAnalysis(List<PairGrowth> rows, List<GrowthSummary> summary) {

    public GrowthAnalysis {
        rows = List.copyOf(rows);
        summary = List.copyOf(summary);
    }

    /**
     * The {@code n} most severe anomalies.
     */
    public List<PairGrowth> digList(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative");
        }
        return rows.subList(0, Math.min(n, rows.size()));
    }

    public long negativeGrowthCount() {
        return rows.stream().filter(PairGrowth::negativeGrowth).count();
    }

    public long alreadyCriticalCount() {
        return rows.stream().filter(PairGrowth::alreadyCritical).count();
    }
}
