/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core;

import ai.evacortex.tonalprint.core.exceptions.InvalidFingerprintException;

import java.util.Arrays;

/**
 * Ordered sequence of 32-bit sub-fingerprints tagged with the id of the algorithm that produced it.
 *
 * <p>Each element summarizes one hop of audio. Values are unsigned 32-bit quantities carried in
 * Java {@code int}s; only the bit pattern is significant. The record owns a private copy of the
 * values, so instances are immutable and safe to share between threads.</p>
 *
 * <p>Sequences produced by different algorithms are never comparable.</p>
 *
 * @param algorithm algorithm id, {@code 0..255}
 * @param values    sub-fingerprints in temporal order
 */
public record FingerprintSequence(int algorithm, int[] values) {

    public static final int MAX_ALGORITHM_ID = 0xFF;

    public FingerprintSequence {
        if (algorithm < 0 || algorithm > MAX_ALGORITHM_ID) {
            throw new InvalidFingerprintException("Algorithm id out of range: " + algorithm);
        }
        if (values == null) {
            throw new NullPointerException("values must not be null");
        }
        values = values.clone();
    }

    public static FingerprintSequence of(int algorithm, int... values) {
        return new FingerprintSequence(algorithm, values);
    }

    public static FingerprintSequence empty(int algorithm) {
        return new FingerprintSequence(algorithm, new int[0]);
    }

    @Override
    public int[] values() {
        return values.clone();
    }

    public int get(int index) {
        return values[index];
    }

    public int length() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public boolean isComparableWith(FingerprintSequence other) {
        return other != null && other.algorithm == algorithm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FingerprintSequence other)) return false;
        return algorithm == other.algorithm && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FingerprintSequence[algorithm=" + algorithm + ", length=" + values.length + "]";
    }
}
