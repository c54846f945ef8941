/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

import ai.evacortex.tonalprint.core.exceptions.MatchTimeoutException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RecursiveTask;

/**
 * Counts matching frame pairs for every offset in {@code [from, to)}, splitting the range in
 * halves until a leaf holds at most {@code offsetsPerTask} offsets. Offsets below the support
 * threshold are not reported. Leaf results are concatenated; ordering is left to the caller.
 */
final class OffsetVoteTask extends RecursiveTask<List<OffsetVote>> {

    private final int[] a;
    private final int[] b;
    private final int from;
    private final int to;
    private final int maxBitErrors;
    private final int minVotes;
    private final int offsetsPerTask;
    private final long deadlineNanos;
    private final boolean bounded;

    OffsetVoteTask(int[] a, int[] b, int from, int to, MatcherOptions options, long deadlineNanos, boolean bounded) {
        this(a, b, from, to, options.maxBitErrors(), options.minOffsetVotes(), options.offsetsPerTask(),
                deadlineNanos, bounded);
    }

    private OffsetVoteTask(int[] a, int[] b, int from, int to, int maxBitErrors, int minVotes,
                           int offsetsPerTask, long deadlineNanos, boolean bounded) {
        this.a = a;
        this.b = b;
        this.from = from;
        this.to = to;
        this.maxBitErrors = maxBitErrors;
        this.minVotes = minVotes;
        this.offsetsPerTask = offsetsPerTask;
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    @Override
    protected List<OffsetVote> compute() {
        if ((long) to - from <= offsetsPerTask) {
            List<OffsetVote> votes = new ArrayList<>();
            for (int offset = from; offset < to; offset++) {
                if (bounded && System.nanoTime() - deadlineNanos > 0) {
                    throw new MatchTimeoutException("Offset search exceeded its time budget at offset " + offset);
                }
                int count = countVotes(a, b, offset, maxBitErrors);
                if (count >= minVotes) {
                    votes.add(new OffsetVote(offset, count));
                }
            }
            return votes;
        }
        int mid = from + (to - from) / 2;
        OffsetVoteTask left = new OffsetVoteTask(a, b, from, mid, maxBitErrors, minVotes, offsetsPerTask,
                deadlineNanos, bounded);
        OffsetVoteTask right = new OffsetVoteTask(a, b, mid, to, maxBitErrors, minVotes, offsetsPerTask,
                deadlineNanos, bounded);
        left.fork();
        List<OffsetVote> rightResult = right.compute();
        List<OffsetVote> leftResult = left.join();
        leftResult.addAll(rightResult);
        return leftResult;
    }

    static int countVotes(int[] a, int[] b, int offset, int maxBitErrors) {
        int start = Math.max(0, offset);
        int end = Math.min(a.length, b.length + offset);
        int votes = 0;
        for (int i = start; i < end; i++) {
            if (Integer.bitCount(a[i] ^ b[i - offset]) <= maxBitErrors) {
                votes++;
            }
        }
        return votes;
    }
}
