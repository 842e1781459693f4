package com.ili.analysis.multirun;

import com.ili.analysis.matching.MatchedPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.ili.analysis.Features.pair;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrackBuilder Tests")
class TrackBuilderTest {

    private static final List<String> RUNS = List.of("2015", "2020", "2024");

    private final TrackBuilder builder = new TrackBuilder();

    @Test
    @DisplayName("Should chain matches through the shared middle survey")
    void testChaining() {
        List<List<MatchedPair>> matches = List.of(
                List.of(pair("A1", 100.0, 10.0, "B1", 14.0)),
                List.of(pair("B1", 100.0, 14.0, "C1", 17.0)));

        List<AnomalyTrack> tracks = builder.build(matches, RUNS);

        assertEquals(1, tracks.size());
        AnomalyTrack track = tracks.get(0);
        assertEquals(List.of("A1", "B1", "C1"), track.featureIds());
        assertEquals(List.of(10.0, 14.0, 17.0), track.depths());
        assertEquals(3, track.detectionCount());
        assertTrue(track.hasCompleteDepthHistory());
        assertEquals(0, track.firstRunIndex().getAsInt());
        assertEquals(100.0, track.firstDistance());
        assertEquals(RUNS, track.runIds());
    }

    @Test
    @DisplayName("An anomaly missed in the middle survey should not be chained")
    void testGapStartsNewTrack() {
        List<List<MatchedPair>> matches = List.of(
                List.of(pair("A1", 100.0, 10.0, "B1", 14.0)),
                List.of(pair("B7", 300.0, 20.0, "C7", 22.0)));

        List<AnomalyTrack> tracks = builder.build(matches, RUNS);

        assertEquals(2, tracks.size());
        AnomalyTrack first = tracks.get(0);
        assertEquals(Arrays.asList("A1", "B1", null), first.featureIds());
        assertEquals(2, first.detectionCount());
        assertFalse(first.hasCompleteDepthHistory());

        AnomalyTrack second = tracks.get(1);
        assertEquals(Arrays.asList(null, "B7", "C7"), second.featureIds());
        assertEquals(1, second.firstRunIndex().getAsInt());
        assertEquals(300.0, second.firstDistance());
        assertNull(second.depthIn(0));
        assertEquals("C7", second.featureIdIn(2));
    }

    @Test
    @DisplayName("Track identifiers should be sequential")
    void testTrackIds() {
        List<List<MatchedPair>> matches = List.of(
                List.of(pair("A1", 100.0, 10.0, "B1", 14.0), pair("A2", 200.0, 10.0, "B2", 12.0)),
                List.of(pair("B2", 200.0, 12.0, "C2", 13.0)));

        List<AnomalyTrack> tracks = builder.build(matches, RUNS);

        assertEquals(2, tracks.size());
        assertEquals(0, tracks.get(0).trackId());
        assertEquals(1, tracks.get(1).trackId());
        assertEquals("C2", tracks.get(1).featureIdIn(2));
    }

    @Test
    void testNoFirstPairMatches() {
        assertTrue(builder.build(List.of(List.of(), List.of()), RUNS).isEmpty());
    }

    @Test
    void testMismatchedSizes() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(List.of()), RUNS));
    }
}
