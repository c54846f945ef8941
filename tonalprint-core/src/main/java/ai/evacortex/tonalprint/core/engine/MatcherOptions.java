/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

import java.time.Duration;

/**
 * Tunable thresholds of the segment matcher.
 *
 * @param maxBitErrors        a frame pair matches when its Hamming distance is at most this value
 * @param minOffsetVotes      offsets with fewer matching frames are treated as noise
 * @param maxCandidateOffsets number of best-voted offsets taken into segment extraction
 * @param maxGapFrames        non-matching frames tolerated inside one segment
 * @param minSegmentFrames    shorter segments are dropped
 * @param offsetsPerTask      offsets counted by one leaf task of the parallel offset search
 * @param timeout             budget for the offset search, {@code null} for none
 */
public record MatcherOptions(
        int maxBitErrors,
        int minOffsetVotes,
        int maxCandidateOffsets,
        int maxGapFrames,
        int minSegmentFrames,
        int offsetsPerTask,
        Duration timeout
) {

    private static final int DEFAULT_MAX_BIT_ERRORS = intProperty("tonalprint.match.maxBitErrors", 2);
    private static final int DEFAULT_MIN_OFFSET_VOTES = intProperty("tonalprint.match.minOffsetVotes", 8);
    private static final int DEFAULT_MAX_CANDIDATE_OFFSETS = intProperty("tonalprint.match.maxCandidateOffsets", 32);
    private static final int DEFAULT_MAX_GAP_FRAMES = intProperty("tonalprint.match.maxGapFrames", 3);
    private static final int DEFAULT_MIN_SEGMENT_FRAMES = intProperty("tonalprint.match.minSegmentFrames", 8);
    private static final int DEFAULT_OFFSETS_PER_TASK = intProperty("tonalprint.match.offsetsPerTask", 128);

    public MatcherOptions {
        if (maxBitErrors < 0 || maxBitErrors > 32)
            throw new IllegalArgumentException("maxBitErrors must be in [0, 32]: " + maxBitErrors);
        if (minOffsetVotes < 1)
            throw new IllegalArgumentException("minOffsetVotes must be positive: " + minOffsetVotes);
        if (maxCandidateOffsets < 1)
            throw new IllegalArgumentException("maxCandidateOffsets must be positive: " + maxCandidateOffsets);
        if (maxGapFrames < 0)
            throw new IllegalArgumentException("maxGapFrames must not be negative: " + maxGapFrames);
        if (minSegmentFrames < 1)
            throw new IllegalArgumentException("minSegmentFrames must be positive: " + minSegmentFrames);
        if (offsetsPerTask < 1)
            throw new IllegalArgumentException("offsetsPerTask must be positive: " + offsetsPerTask);
        if (timeout != null && (timeout.isNegative() || timeout.isZero()))
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }

    public static MatcherOptions defaultOptions() {
        return new MatcherOptions(
                DEFAULT_MAX_BIT_ERRORS,
                DEFAULT_MIN_OFFSET_VOTES,
                DEFAULT_MAX_CANDIDATE_OFFSETS,
                DEFAULT_MAX_GAP_FRAMES,
                DEFAULT_MIN_SEGMENT_FRAMES,
                DEFAULT_OFFSETS_PER_TASK,
                null);
    }

    /** Same thresholds, offset search confined to the calling thread. */
    public MatcherOptions sequential() {
        return withOffsetsPerTask(Integer.MAX_VALUE);
    }

    public MatcherOptions withMaxBitErrors(int value) {
        return new MatcherOptions(value, minOffsetVotes, maxCandidateOffsets, maxGapFrames,
                minSegmentFrames, offsetsPerTask, timeout);
    }

    public MatcherOptions withMinOffsetVotes(int value) {
        return new MatcherOptions(maxBitErrors, value, maxCandidateOffsets, maxGapFrames,
                minSegmentFrames, offsetsPerTask, timeout);
    }

    public MatcherOptions withMaxCandidateOffsets(int value) {
        return new MatcherOptions(maxBitErrors, minOffsetVotes, value, maxGapFrames,
                minSegmentFrames, offsetsPerTask, timeout);
    }

    public MatcherOptions withMaxGapFrames(int value) {
        return new MatcherOptions(maxBitErrors, minOffsetVotes, maxCandidateOffsets, value,
                minSegmentFrames, offsetsPerTask, timeout);
    }

    public MatcherOptions withMinSegmentFrames(int value) {
        return new MatcherOptions(maxBitErrors, minOffsetVotes, maxCandidateOffsets, maxGapFrames,
                value, offsetsPerTask, timeout);
    }

    public MatcherOptions withOffsetsPerTask(int value) {
        return new MatcherOptions(maxBitErrors, minOffsetVotes, maxCandidateOffsets, maxGapFrames,
                minSegmentFrames, value, timeout);
    }

    public MatcherOptions withTimeout(Duration value) {
        return new MatcherOptions(maxBitErrors, minOffsetVotes, maxCandidateOffsets, maxGapFrames,
                minSegmentFrames, offsetsPerTask, value);
    }

    private static int intProperty(String key, int fallback) {
        return Integer.parseInt(System.getProperty(key, Integer.toString(fallback)));
    }
}
