package com.ili.analysis.multirun;

import com.ili.analysis.matching.MatchedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chains pairwise matches of consecutive surveys into anomaly tracks.
 *
 * <p>Every match of the first pair seeds a track. For each later pair, a match extends the track
 * whose identifier in the pair's earlier survey equals the match's Run-A identifier; otherwise it
 * starts a new track. Tracks are never revisited, split or merged, so an anomaly missed in one
 * survey and found again later yields two tracks.</p>
 */
public class TrackBuilder {
    private static final Logger log = LoggerFactory.getLogger(TrackBuilder.class);

    /**
     * Builds tracks.
     *
     * @param pairMatches matched pairs of survey pairs (0,1), (1,2), ...
     * @param runIds      survey identifiers in chronological order
     * @throws IllegalArgumentException if {@code pairMatches} does not hold one entry per consecutive pair
     */
    public List<AnomalyTrack> build(List<List<MatchedPair>> pairMatches, List<String> runIds) {
        if (pairMatches.size() != runIds.size() - 1) {
            throw new IllegalArgumentException("Expected " + (runIds.size() - 1)
                    + " pairwise match lists for " + runIds.size() + " runs, got " + pairMatches.size());
        }
        List<MutableTrack> tracks = new ArrayList<>();
        if (pairMatches.isEmpty() || pairMatches.get(0).isEmpty()) {
            log.info("No matches in the first survey pair; no tracks built");
            return List.of();
        }

        int runCount = runIds.size();
        Map<String, MutableTrack> byLatestId = new HashMap<>();
        for (MatchedPair pair : pairMatches.get(0)) {
            MutableTrack track = new MutableTrack(tracks.size(), runCount, pair.distanceA());
            track.set(0, pair.featureIdA(), pair.depthA());
            track.set(1, pair.featureIdB(), pair.depthB());
            tracks.add(track);
            byLatestId.put(pair.featureIdB(), track);
        }

        for (int p = 1; p < pairMatches.size(); p++) {
            Map<String, MutableTrack> next = new HashMap<>();
            int extended = 0;
            for (MatchedPair pair : pairMatches.get(p)) {
                MutableTrack track = byLatestId.get(pair.featureIdA());
                if (track != null) {
                    extended++;
                } else {
                    track = new MutableTrack(tracks.size(), runCount, pair.distanceA());
                    track.set(p, pair.featureIdA(), pair.depthA());
                    tracks.add(track);
                }
                track.set(p + 1, pair.featureIdB(), pair.depthB());
                next.put(pair.featureIdB(), track);
            }
            byLatestId = next;
            log.debug("Pair {} -> {}: {} tracks extended, {} started",
                    runIds.get(p), runIds.get(p + 1), extended, pairMatches.get(p).size() - extended);
        }

        List<AnomalyTrack> result = tracks.stream().map(t -> t.toTrack(runIds)).toList();
        log.info("Built {} anomaly tracks across {} runs", result.size(), runCount);
        return result;
    }

    private static final class MutableTrack {
        private final int trackId;
        private final String[] featureIds;
        private final Double[] depths;
        private final double firstDistance;

        private MutableTrack(int trackId, int runCount, double firstDistance) {
            this.trackId = trackId;
            this.featureIds = new String[runCount];
            this.depths = new Double[runCount];
            this.firstDistance = firstDistance;
        }

        private void set(int runIndex, String featureId, Double depth) {
            featureIds[runIndex] = featureId;
            depths[runIndex] = depth;
        }

        private AnomalyTrack toTrack(List<String> runIds) {
            return new AnomalyTrack(trackId, runIds, Arrays.asList(featureIds), Arrays.asList(depths), firstDistance);
        }
    }
}
