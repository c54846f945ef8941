/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core;

import java.util.Arrays;
import java.util.Random;

/**
 * Utility class for creating synthetic {@link FingerprintSequence} instances for testing.
 */
public class FingerprintTestUtils {

    public static final int ALGORITHM = FingerprintAlgorithm.DEFAULT.id();

    private static final int[] SHORT_DELTAS = {0x0, 0x1, 0x2, 0x4, 0x8, 0x3, 0x6};

    /**
     * Uniformly random sub-fingerprints; two such sequences practically never share a frame.
     */
    public static FingerprintSequence randomSequence(int length, long seed) {
        Random random = new Random(seed);
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = random.nextInt();
        }
        return new FingerprintSequence(ALGORITHM, values);
    }

    /**
     * Sequence resembling real audio: mostly small steps between neighbours, with an occasional jump.
     *
     * @param jumpEvery one step in {@code jumpEvery} (on average) XORs a random word
     */
    public static FingerprintSequence smoothSequence(int length, int jumpEvery, long seed) {
        Random random = new Random(seed);
        int[] values = new int[length];
        int current = 0;
        for (int i = 0; i < length; i++) {
            if (random.nextInt(jumpEvery) == 0) {
                current ^= random.nextInt();
            } else {
                current ^= SHORT_DELTAS[random.nextInt(SHORT_DELTAS.length)];
            }
            values[i] = current;
        }
        return new FingerprintSequence(ALGORITHM, values);
    }

    /**
     * Sequence whose elements all lie within {@code noiseBits} flipped bits of {@code center}.
     */
    public static FingerprintSequence noisyAround(int center, int length, int noiseBits, long seed) {
        Random random = new Random(seed);
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            int v = center;
            for (int k = 0; k < noiseBits; k++) {
                v ^= 1 << random.nextInt(32);
            }
            values[i] = v;
        }
        return new FingerprintSequence(ALGORITHM, values);
    }

    public static FingerprintSequence concat(FingerprintSequence... parts) {
        int total = Arrays.stream(parts).mapToInt(FingerprintSequence::length).sum();
        int[] values = new int[total];
        int pos = 0;
        for (FingerprintSequence part : parts) {
            int[] v = part.values();
            System.arraycopy(v, 0, values, pos, v.length);
            pos += v.length;
        }
        return new FingerprintSequence(parts[0].algorithm(), values);
    }

    /**
     * Flips one random bit in every {@code every}-th frame.
     */
    public static FingerprintSequence flipOneBitEvery(FingerprintSequence source, int every, long seed) {
        Random random = new Random(seed);
        int[] values = source.values();
        for (int i = 0; i < values.length; i += every) {
            values[i] ^= 1 << random.nextInt(32);
        }
        return new FingerprintSequence(source.algorithm(), values);
    }

    /**
     * Inverts every bit of the frames in {@code [from, to)}.
     */
    public static FingerprintSequence invertRange(FingerprintSequence source, int from, int to) {
        int[] values = source.values();
        for (int i = from; i < to; i++) {
            values[i] = ~values[i];
        }
        return new FingerprintSequence(source.algorithm(), values);
    }

    public static FingerprintSequence slice(FingerprintSequence source, int from, int to) {
        return new FingerprintSequence(source.algorithm(), Arrays.copyOfRange(source.values(), from, to));
    }
}
