/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

import ai.evacortex.tonalprint.core.result.MatchSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups matching frames along one fixed offset into segments.
 *
 * <p>A segment opens on a matching frame and stays open across at most {@code maxGapFrames}
 * consecutive non-matching frames. It closes on its last matching frame, so a segment always
 * starts and ends with a match. Gap frames inside a segment count towards its score.</p>
 */
final class SegmentExtractor {

    private SegmentExtractor() {}

    static List<MatchSegment> extract(int[] a, int[] b, int offset, MatcherOptions options) {
        return extract(a, b, offset, Math.max(0, offset), Math.min(a.length, b.length + offset), options);
    }

    /** Extracts segments whose first-sequence indices fall in {@code [fromA, toA)}. */
    static List<MatchSegment> extract(int[] a, int[] b, int offset, int fromA, int toA, MatcherOptions options) {
        List<MatchSegment> segments = new ArrayList<>();
        int start = -1;
        int lastMatch = -1;
        long sum = 0;
        long sumAtLastMatch = 0;

        for (int i = fromA; i < toA; i++) {
            int distance = Integer.bitCount(a[i] ^ b[i - offset]);
            boolean matching = distance <= options.maxBitErrors();

            if (start < 0) {
                if (!matching) continue;
                start = i;
                sum = 0;
            } else if (!matching && i - lastMatch > options.maxGapFrames()) {
                close(segments, offset, start, lastMatch, sumAtLastMatch, options);
                start = -1;
                continue;
            }

            sum += distance;
            if (matching) {
                lastMatch = i;
                sumAtLastMatch = sum;
            }
        }
        if (start >= 0) {
            close(segments, offset, start, lastMatch, sumAtLastMatch, options);
        }
        return segments;
    }

    /** Mean Hamming distance over {@code [fromA, toA)} along {@code offset}. */
    static double score(int[] a, int[] b, int offset, int fromA, int toA) {
        long sum = 0;
        for (int i = fromA; i < toA; i++) {
            sum += Integer.bitCount(a[i] ^ b[i - offset]);
        }
        return (double) sum / (toA - fromA);
    }

    private static void close(List<MatchSegment> out, int offset, int start, int lastMatch,
                              long sum, MatcherOptions options) {
        int length = lastMatch - start + 1;
        if (length < options.minSegmentFrames()) return;
        out.add(new MatchSegment(start, start - offset, length, (double) sum / length));
    }
}
