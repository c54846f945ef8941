/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.codec;

/**
 * Immutable mapping between 3-bit codes and the XOR deltas they stand for.
 *
 * <pre>
 *   code  delta        code  delta
 *   0     0x0          4     0x8
 *   1     0x1          5     0x3
 *   2     0x2          6     0x6
 *   3     0x4          7     escape
 * </pre>
 *
 * Any delta not listed is written as {@link #ESCAPE} followed by its full value in the
 * exception list.
 */
public final class DeltaCodeTable {

    public static final int CODE_BITS = 3;
    public static final int ESCAPE = (1 << CODE_BITS) - 1;

    private static final int[] CODE_TO_DELTA = {0x0, 0x1, 0x2, 0x4, 0x8, 0x3, 0x6};

    // indexed by delta, valid for deltas below DELTA_INDEX_SIZE
    private static final int DELTA_INDEX_SIZE = 16;
    private static final byte[] DELTA_TO_CODE = new byte[DELTA_INDEX_SIZE];

    static {
        java.util.Arrays.fill(DELTA_TO_CODE, (byte) ESCAPE);
        for (int code = 0; code < CODE_TO_DELTA.length; code++) {
            DELTA_TO_CODE[CODE_TO_DELTA[code]] = (byte) code;
        }
    }

    private DeltaCodeTable() {}

    /** Returns the code for {@code delta}, or {@link #ESCAPE} when the delta has no short form. */
    public static int codeFor(int delta) {
        if (delta < 0 || delta >= DELTA_INDEX_SIZE) return ESCAPE;
        return DELTA_TO_CODE[delta];
    }

    public static int deltaFor(int code) {
        if (code < 0 || code >= CODE_TO_DELTA.length) {
            throw new IllegalArgumentException("No delta for code " + code);
        }
        return CODE_TO_DELTA[code];
    }

    public static boolean isEscape(int code) {
        return code == ESCAPE;
    }
}
