/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.exceptions.AlgorithmMismatchException;
import ai.evacortex.tonalprint.core.exceptions.InvalidMatchInputException;
import ai.evacortex.tonalprint.core.exceptions.MatchTimeoutException;
import ai.evacortex.tonalprint.core.result.MatchSegment;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static ai.evacortex.tonalprint.core.FingerprintTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

abstract class SegmentMatcherContractTest {

    protected abstract SegmentMatcher matcher();

    private static void assertSegment(MatchSegment s, int startA, int startB, int length) {
        assertEquals(startA, s.startIndexA(), "startIndexA");
        assertEquals(startB, s.startIndexB(), "startIndexB");
        assertEquals(length, s.lengthInFrames(), "lengthInFrames");
    }

    private static void assertWellFormed(List<MatchSegment> segments) {
        for (int i = 0; i < segments.size(); i++) {
            MatchSegment s = segments.get(i);
            assertTrue(s.rawScore() >= 0 && s.rawScore() <= 32, "raw score bound");
            assertTrue(s.normalizedScore() >= 0 && s.normalizedScore() <= 100, "normalized score bound");
            if (i > 0) {
                assertTrue(segments.get(i - 1).endIndexA() <= s.startIndexA(),
                        "Segments must be ordered and must not overlap in A");
            }
        }
    }

    @Test
    void identicalSequences_yieldOneFullSegment() {
        FingerprintSequence s = randomSequence(64, 1);
        List<MatchSegment> segments = matcher().match(s, s);
        assertEquals(1, segments.size());
        assertSegment(segments.get(0), 0, 0, 64);
        assertEquals(0.0, segments.get(0).rawScore(), 1e-12);
        assertEquals(100, segments.get(0).normalizedScore());
    }

    @Test
    void identicalSmoothSequences_neighbourOffsetsDoNotLeak() {
        FingerprintSequence s = smoothSequence(300, 40, 2);
        List<MatchSegment> segments = matcher().match(s, s);
        assertEquals(1, segments.size(), "Near-diagonal offsets must be absorbed by the exact one");
        assertSegment(segments.get(0), 0, 0, 300);
        assertEquals(100, segments.get(0).normalizedScore());
    }

    @Test
    void prefixedCopy_isFoundAtItsOffset() {
        FingerprintSequence s = randomSequence(100, 3);
        FingerprintSequence s2 = concat(randomSequence(10, 4), s);

        List<MatchSegment> forward = matcher().match(s, s2);
        assertEquals(1, forward.size());
        assertSegment(forward.get(0), 0, 10, 100);
        assertEquals(-10, forward.get(0).offset());
        assertTrue(forward.get(0).normalizedScore() >= 95);

        List<MatchSegment> backward = matcher().match(s2, s);
        assertEquals(1, backward.size());
        assertSegment(backward.get(0), 10, 0, 100);
    }

    @Test
    void partialOverlap_reportsSharedPartOnly() {
        FingerprintSequence common = randomSequence(80, 5);
        FingerprintSequence a = concat(randomSequence(50, 6), common);
        FingerprintSequence b = concat(common, randomSequence(40, 7));

        List<MatchSegment> segments = matcher().match(a, b);
        assertEquals(1, segments.size());
        assertSegment(segments.get(0), 50, 0, 80);
    }

    @Test
    void reorderedParts_yieldTwoSegmentsOrderedByA() {
        FingerprintSequence c1 = randomSequence(60, 8);
        FingerprintSequence c2 = randomSequence(60, 9);
        FingerprintSequence a = concat(c1, randomSequence(30, 10), c2);
        FingerprintSequence b = concat(c2, randomSequence(20, 11), c1);

        List<MatchSegment> segments = matcher().match(a, b);
        assertEquals(2, segments.size());
        assertSegment(segments.get(0), 0, 80, 60);
        assertSegment(segments.get(1), 90, 0, 60);
        assertWellFormed(segments);
    }

    @Test
    void lightNoise_keepsSegmentWithHighScore() {
        FingerprintSequence s = randomSequence(200, 12);
        FingerprintSequence noisy = flipOneBitEvery(s, 3, 13);

        List<MatchSegment> segments = matcher().match(s, noisy);
        assertEquals(1, segments.size());
        MatchSegment seg = segments.get(0);
        assertSegment(seg, 0, 0, 200);
        assertTrue(seg.rawScore() > 0.0, "Flipped bits must show up in the raw score");
        assertTrue(seg.normalizedScore() >= 95);
        assertWellFormed(segments);
    }

    @Test
    void shortDropout_isBridged() {
        FingerprintSequence s = randomSequence(100, 14);
        FingerprintSequence damaged = invertRange(s, 50, 52);

        List<MatchSegment> segments = matcher().match(s, damaged);
        assertEquals(1, segments.size());
        assertSegment(segments.get(0), 0, 0, 100);
        assertEquals(0.64, segments.get(0).rawScore(), 1e-9);
        assertEquals(98, segments.get(0).normalizedScore());
    }

    @Test
    void longDropout_splitsSegment() {
        FingerprintSequence s = randomSequence(100, 15);
        FingerprintSequence damaged = invertRange(s, 40, 60);

        List<MatchSegment> segments = matcher().match(s, damaged);
        assertEquals(2, segments.size());
        assertSegment(segments.get(0), 0, 0, 40);
        assertSegment(segments.get(1), 60, 60, 40);
    }

    @Test
    void repetitiveContent_prefersLongestPerfectAlignment() {
        FingerprintSequence period = randomSequence(20, 16);
        FingerprintSequence a = concat(period, period, period, period, period);

        List<MatchSegment> segments = matcher().match(a, a);
        assertEquals(1, segments.size());
        assertSegment(segments.get(0), 0, 0, 100);
    }

    @Test
    void unrelatedSequences_yieldEmptyResult() {
        List<MatchSegment> segments = matcher().match(randomSequence(150, 17), randomSequence(120, 18));
        assertTrue(segments.isEmpty());
    }

    @Test
    void shorterThanMinimumSegment_isDropped() {
        FingerprintSequence shared = randomSequence(5, 19);
        FingerprintSequence a = concat(randomSequence(30, 20), shared);
        FingerprintSequence b = concat(shared, randomSequence(30, 21));
        assertTrue(matcher().match(a, b).isEmpty());
    }

    @Test
    void algorithmMismatch_fails() {
        FingerprintSequence a = FingerprintSequence.of(1, randomSequence(40, 22).values());
        FingerprintSequence b = FingerprintSequence.of(2, randomSequence(40, 22).values());
        assertThrows(AlgorithmMismatchException.class, () -> matcher().match(a, b));
    }

    @Test
    void emptyInput_fails() {
        FingerprintSequence s = randomSequence(40, 23);
        FingerprintSequence empty = FingerprintSequence.empty(s.algorithm());
        assertThrows(InvalidMatchInputException.class, () -> matcher().match(s, empty));
        assertThrows(InvalidMatchInputException.class, () -> matcher().match(empty, s));
        assertThrows(NullPointerException.class, () -> matcher().match(s, null));
    }

    @Test
    void tinyBudget_timesOut() {
        FingerprintSequence a = randomSequence(4000, 24);
        FingerprintSequence b = randomSequence(4000, 25);
        MatcherOptions hurried = matcher().options().withTimeout(Duration.ofNanos(1));
        assertThrows(MatchTimeoutException.class, () -> matcher().match(a, b, hurried));
    }

    @Test
    void matchingIsDeterministic() {
        FingerprintSequence common = smoothSequence(150, 5, 26);
        FingerprintSequence a = concat(randomSequence(17, 27), common);
        FingerprintSequence b = concat(flipOneBitEvery(common, 4, 28), randomSequence(9, 29));
        assertEquals(matcher().match(a, b), matcher().match(a, b));
    }
}
