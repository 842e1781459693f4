package com.ili.analysis.multirun;

import com.ili.analysis.alignment.AlignmentResult;
import com.ili.analysis.matching.MatchingResult;

/**
 * Alignment and matching of one consecutive survey pair.
 */
public record PairwiseStep(String runIdA, String runIdB, double yearsBetween,
                           AlignmentResult alignment, MatchingResult matching) {
}
