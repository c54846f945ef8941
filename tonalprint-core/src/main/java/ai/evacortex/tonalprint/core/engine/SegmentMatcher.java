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

import java.util.List;

/**
 * {@code SegmentMatcher} finds time-aligned stretches shared by two sub-fingerprint sequences.
 *
 * <p>The search works in two phases:</p>
 * <ol>
 *     <li><b>Offset search.</b> Every relative shift {@code o} in {@code [-(len(b) - 1), len(a) - 1]}
 *     is scored by the number of frame pairs {@code (i, i - o)} whose Hamming distance stays within
 *     {@link MatcherOptions#maxBitErrors()}. Weakly supported offsets are discarded.</li>
 *     <li><b>Segment extraction.</b> Along each surviving offset, matching frames are grouped into
 *     {@link MatchSegment}s, tolerating short gaps. Overlaps between offsets are resolved in favour
 *     of the lower raw score.</li>
 * </ol>
 *
 * <p>Implementations must be deterministic and free of side effects. A pair without a common
 * region yields an empty list; this is a result, not an error.</p>
 *
 * @see MatcherOptions
 * @see OffsetVotingMatcher
 */
public interface SegmentMatcher {

    /**
     * Matches two sequences using the options the matcher was created with.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return non-overlapping segments (in {@code a}), ordered by {@link MatchSegment#startIndexA()}
     * @throws AlgorithmMismatchException if the sequences come from different algorithms
     * @throws InvalidMatchInputException if either sequence is empty
     * @throws MatchTimeoutException      if the configured time budget runs out
     * @throws NullPointerException       if either argument is {@code null}
     */
    List<MatchSegment> match(FingerprintSequence a, FingerprintSequence b);

    /**
     * Matches two sequences with explicit options.
     *
     * @param a       the first sequence
     * @param b       the second sequence
     * @param options thresholds for this call
     * @return non-overlapping segments ordered by {@link MatchSegment#startIndexA()}
     */
    List<MatchSegment> match(FingerprintSequence a, FingerprintSequence b, MatcherOptions options);

    MatcherOptions options();
}
