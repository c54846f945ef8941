/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.result;

import ai.evacortex.tonalprint.core.FingerprintAlgorithm;

/**
 * A stretch of frames judged to carry the same audio in both compared sequences.
 *
 * @param startIndexA    first frame of the stretch in the first sequence
 * @param startIndexB    first frame of the stretch in the second sequence
 * @param lengthInFrames number of aligned frames
 * @param rawScore       mean per-frame Hamming distance over the stretch, {@code [0, 32]}; lower is better
 */
public record MatchSegment(int startIndexA, int startIndexB, int lengthInFrames, double rawScore) {

    public static final double MAX_RAW_SCORE = 32.0;

    public MatchSegment {
        if (startIndexA < 0 || startIndexB < 0) {
            throw new IllegalArgumentException("Negative segment start: " + startIndexA + ", " + startIndexB);
        }
        if (lengthInFrames <= 0) {
            throw new IllegalArgumentException("Segment length must be positive: " + lengthInFrames);
        }
        if (!(rawScore >= 0.0 && rawScore <= MAX_RAW_SCORE)) {
            throw new IllegalArgumentException("Raw score out of range: " + rawScore);
        }
    }

    public int endIndexA() {
        return startIndexA + lengthInFrames;
    }

    public int endIndexB() {
        return startIndexB + lengthInFrames;
    }

    /** Relative shift of the second sequence: frame {@code i} of A aligns with frame {@code i - offset()} of B. */
    public int offset() {
        return startIndexA - startIndexB;
    }

    public int normalizedScore() {
        return normalize(rawScore);
    }

    public SegmentPosition position() {
        return new SegmentPosition(startIndexA, startIndexB, lengthInFrames);
    }

    public SegmentPosition positionMillis(FingerprintAlgorithm algorithm) {
        return new SegmentPosition(
                algorithm.framesToMillis(startIndexA),
                algorithm.framesToMillis(startIndexB),
                algorithm.framesToMillis(lengthInFrames));
    }

    public double startSecondsA(double hopSeconds) {
        return startIndexA * hopSeconds;
    }

    public double startSecondsB(double hopSeconds) {
        return startIndexB * hopSeconds;
    }

    public double durationSeconds(double hopSeconds) {
        return lengthInFrames * hopSeconds;
    }

    public static int normalize(double rawScore) {
        long percent = Math.round(100.0 * (1.0 - rawScore / MAX_RAW_SCORE));
        return (int) Math.max(0, Math.min(100, percent));
    }
}
