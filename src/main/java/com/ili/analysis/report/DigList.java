package com.ili.analysis.report;

import com.ili.analysis.growth.PairGrowth;
import com.ili.analysis.matching.MatchedPair;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranked excavation candidates taken from severity-sorted growth rows.
 */
public final class DigList {

    public static final int DEFAULT_SIZE = 50;

    private DigList() {
        // Utility class
    }

    /**
     * The first {@code n} rows, ranked from 1. Rows are expected in descending severity order.
     */
    public static List<DigListEntry> top(List<PairGrowth> rows, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative");
        }
        int size = Math.min(n, rows.size());
        List<DigListEntry> entries = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            entries.add(toEntry(i + 1, rows.get(i)));
        }
        return entries;
    }

    static DigListEntry toEntry(int rank, PairGrowth row) {
        MatchedPair pair = row.pair();
        return new DigListEntry(rank,
                pair.featureIdA(),
                pair.featureIdB(),
                pair.category().getLabel(),
                pair.distanceA(),
                pair.clockDegA(),
                pair.depthA(),
                pair.depthB(),
                finite(row.depthGrowthRate()),
                finite(row.remainingLifeYears()),
                finite(row.projectedDepthPct()),
                row.severityScore(),
                pair.status().name());
    }

    static Double finite(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }
}
