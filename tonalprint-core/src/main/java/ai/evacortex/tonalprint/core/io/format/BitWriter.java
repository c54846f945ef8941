/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.format;

import java.util.Arrays;

/**
 * Growable byte buffer with a bit cursor. Values are appended least-significant bit first,
 * so a code may straddle a byte boundary. The final partial byte is zero-padded.
 */
public final class BitWriter {

    private static final int INITIAL_CAPACITY = 64;

    private byte[] buffer;
    private long bitPosition;

    public BitWriter() {
        this(INITIAL_CAPACITY);
    }

    public BitWriter(int expectedBytes) {
        this.buffer = new byte[Math.max(1, expectedBytes)];
    }

    public void write(int value, int bits) {
        if (bits < 1 || bits > 32) {
            throw new IllegalArgumentException("Unsupported bit width: " + bits);
        }
        ensureCapacity(bitPosition + bits);
        for (int i = 0; i < bits; i++) {
            if (((value >>> i) & 1) != 0) {
                int byteIndex = (int) (bitPosition >>> 3);
                buffer[byteIndex] |= (byte) (1 << (bitPosition & 7));
            }
            bitPosition++;
        }
    }

    public long bitLength() {
        return bitPosition;
    }

    public int byteLength() {
        return (int) ((bitPosition + 7) >>> 3);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, byteLength());
    }

    private void ensureCapacity(long bits) {
        long needed = (bits + 7) >>> 3;
        if (needed > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Bit stream too large: " + bits + " bits");
        }
        if (needed > buffer.length) {
            long grown = Math.max(needed, (long) buffer.length * 2);
            buffer = Arrays.copyOf(buffer, (int) Math.min(grown, Integer.MAX_VALUE - 8));
        }
    }
}
