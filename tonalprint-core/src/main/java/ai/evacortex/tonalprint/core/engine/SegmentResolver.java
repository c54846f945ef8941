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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Global merge of candidate segments coming from different offsets.
 *
 * <p>Candidates are visited best score first. Each one keeps only the part of its range in the
 * first sequence that no accepted segment claims yet; the remaining pieces are trimmed to
 * matching frames, re-scored, and accepted when still long enough. The accepted segments never
 * overlap in the first sequence.</p>
 */
final class SegmentResolver {

    static final Comparator<MatchSegment> BEST_FIRST = Comparator
            .comparingDouble(MatchSegment::rawScore)
            .thenComparing(MatchSegment::lengthInFrames, Comparator.reverseOrder())
            .thenComparingInt(MatchSegment::startIndexA)
            .thenComparingInt(MatchSegment::startIndexB);

    private SegmentResolver() {}

    static List<MatchSegment> resolve(List<MatchSegment> candidates, int[] a, int[] b, MatcherOptions options) {
        List<MatchSegment> ordered = new ArrayList<>(candidates);
        ordered.sort(BEST_FIRST);

        TreeMap<Integer, Integer> claimed = new TreeMap<>();
        List<MatchSegment> accepted = new ArrayList<>();

        for (MatchSegment candidate : ordered) {
            for (int[] piece : unclaimed(claimed, candidate.startIndexA(), candidate.endIndexA())) {
                MatchSegment kept = trim(candidate, piece[0], piece[1], a, b, options);
                if (kept != null) {
                    claimed.put(kept.startIndexA(), kept.endIndexA());
                    accepted.add(kept);
                }
            }
        }

        accepted.sort(Comparator.comparingInt(MatchSegment::startIndexA));
        return accepted;
    }

    private static List<int[]> unclaimed(TreeMap<Integer, Integer> claimed, int from, int to) {
        List<int[]> pieces = new ArrayList<>();
        int cursor = from;
        Map.Entry<Integer, Integer> before = claimed.floorEntry(from);
        if (before != null && before.getValue() > cursor) {
            cursor = before.getValue();
        }
        for (Map.Entry<Integer, Integer> range : claimed.subMap(from, true, to, false).entrySet()) {
            if (range.getKey() > cursor) {
                pieces.add(new int[]{cursor, range.getKey()});
            }
            cursor = Math.max(cursor, range.getValue());
        }
        if (cursor < to) {
            pieces.add(new int[]{cursor, to});
        }
        return pieces;
    }

    private static MatchSegment trim(MatchSegment source, int fromA, int toA, int[] a, int[] b, MatcherOptions options) {
        int offset = source.offset();
        if (fromA == source.startIndexA() && toA == source.endIndexA()) {
            return source;
        }
        int start = fromA;
        int end = toA;
        while (start < end && Integer.bitCount(a[start] ^ b[start - offset]) > options.maxBitErrors()) start++;
        while (end > start && Integer.bitCount(a[end - 1] ^ b[end - 1 - offset]) > options.maxBitErrors()) end--;
        if (end - start < options.minSegmentFrames()) {
            return null;
        }
        double score = SegmentExtractor.score(a, b, offset, start, end);
        return new MatchSegment(start, start - offset, end - start, score);
    }
}
