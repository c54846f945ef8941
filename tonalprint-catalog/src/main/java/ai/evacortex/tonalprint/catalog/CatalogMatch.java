/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog;

import ai.evacortex.tonalprint.core.result.MatchSegment;

import java.util.Comparator;
import java.util.List;

/**
 * A stored fingerprint that shares material with a query.
 *
 * @param id            ID of the stored fingerprint
 * @param segments      matching segments, the query being the first sequence
 * @param bestScore     highest normalized score among the segments
 * @param coveredFrames total length of all segments
 */
public record CatalogMatch(String id, List<MatchSegment> segments, int bestScore, int coveredFrames) {

    public static final Comparator<CatalogMatch> RANKING = Comparator
            .comparingInt(CatalogMatch::bestScore).reversed()
            .thenComparing(CatalogMatch::coveredFrames, Comparator.reverseOrder())
            .thenComparing(CatalogMatch::id);

    public CatalogMatch {
        segments = List.copyOf(segments);
    }

    public static CatalogMatch of(String id, List<MatchSegment> segments) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A catalog match needs at least one segment");
        }
        int best = 0;
        int covered = 0;
        for (MatchSegment s : segments) {
            best = Math.max(best, s.normalizedScore());
            covered += s.lengthInFrames();
        }
        return new CatalogMatch(id, segments, best, covered);
    }
}
