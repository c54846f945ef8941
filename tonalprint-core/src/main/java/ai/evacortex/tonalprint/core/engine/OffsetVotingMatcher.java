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
import ai.evacortex.tonalprint.core.result.MatchSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;

public final class OffsetVotingMatcher implements SegmentMatcher {

    private static final Logger LOG = LogManager.getLogger(OffsetVotingMatcher.class);

    static final Comparator<OffsetVote> STRONGEST_FIRST = Comparator
            .comparingInt(OffsetVote::votes).reversed()
            .thenComparingInt((OffsetVote v) -> Math.abs(v.offset()))
            .thenComparingInt(OffsetVote::offset);

    private final MatcherOptions options;
    private final ForkJoinPool pool;

    public OffsetVotingMatcher() {
        this(MatcherOptions.defaultOptions());
    }

    public OffsetVotingMatcher(MatcherOptions options) {
        this(options, ForkJoinPool.commonPool());
    }

    public OffsetVotingMatcher(MatcherOptions options, ForkJoinPool pool) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    @Override
    public MatcherOptions options() {
        return options;
    }

    @Override
    public List<MatchSegment> match(FingerprintSequence a, FingerprintSequence b) {
        return match(a, b, options);
    }

    @Override
    public List<MatchSegment> match(FingerprintSequence a, FingerprintSequence b, MatcherOptions options) {
        if (a == null || b == null) {
            throw new NullPointerException("sequences must not be null");
        }
        Objects.requireNonNull(options, "options must not be null");
        if (a.algorithm() != b.algorithm()) {
            throw new AlgorithmMismatchException(a.algorithm(), b.algorithm());
        }
        if (a.isEmpty()) throw new InvalidMatchInputException("first sequence is empty");
        if (b.isEmpty()) throw new InvalidMatchInputException("second sequence is empty");

        int[] va = a.values();
        int[] vb = b.values();

        List<OffsetVote> candidates = searchOffsets(va, vb, options);
        List<MatchSegment> extracted = new ArrayList<>();
        for (OffsetVote vote : candidates) {
            extracted.addAll(SegmentExtractor.extract(va, vb, vote.offset(), options));
        }
        List<MatchSegment> segments = SegmentResolver.resolve(extracted, va, vb, options);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Matched {}x{} frames: {} candidate offsets, {} candidate segments, {} kept",
                    va.length, vb.length, candidates.size(), extracted.size(), segments.size());
        }
        return segments;
    }

    List<OffsetVote> searchOffsets(int[] a, int[] b, MatcherOptions options) {
        int from = -(b.length - 1);
        int to = a.length;
        boolean bounded = options.timeout() != null;
        long deadline = bounded ? System.nanoTime() + options.timeout().toNanos() : 0L;

        OffsetVoteTask task = new OffsetVoteTask(a, b, from, to, options, deadline, bounded);
        List<OffsetVote> votes = ((long) to - from <= options.offsetsPerTask())
                ? task.invoke()
                : pool.invoke(task);

        votes.sort(STRONGEST_FIRST);
        if (votes.size() > options.maxCandidateOffsets()) {
            votes = new ArrayList<>(votes.subList(0, options.maxCandidateOffsets()));
        }
        return votes;
    }
}
