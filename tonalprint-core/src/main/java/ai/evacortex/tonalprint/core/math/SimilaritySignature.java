/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.math;

import ai.evacortex.tonalprint.core.FingerprintSequence;

import java.util.Objects;

/**
 * Reduces a whole sub-fingerprint sequence to a single 32-bit value by per-bit majority vote.
 *
 * <p>Bit {@code k} of the signature is set when strictly more than half of the elements have
 * bit {@code k} set; ties yield zero. Sequences whose elements are close in Hamming distance
 * tend to produce signatures that are close as well, so
 * {@code hammingDistance(compute(a), compute(b))} serves as an O(1) pre-filter before segment
 * matching. The relation is statistical, not monotonic.</p>
 *
 * <p>The empty sequence has signature {@code 0}.</p>
 */
public final class SimilaritySignature {

    public static final int BITS = Integer.SIZE;

    private SimilaritySignature() {}

    public static int compute(FingerprintSequence sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        return compute(sequence.values());
    }

    public static int compute(int[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int[] setCounts = new int[BITS];
        for (int v : values) {
            for (int bit = 0; bit < BITS; bit++) {
                setCounts[bit] += (v >>> bit) & 1;
            }
        }
        int signature = 0;
        for (int bit = 0; bit < BITS; bit++) {
            int unset = values.length - setCounts[bit];
            if (setCounts[bit] > unset) {
                signature |= 1 << bit;
            }
        }
        return signature;
    }

    public static int hammingDistance(int a, int b) {
        return Integer.bitCount(a ^ b);
    }

    /** Similarity in {@code [0, 1]}: one minus the fraction of differing bits. */
    public static double similarity(int a, int b) {
        return 1.0 - (double) hammingDistance(a, b) / BITS;
    }
}
