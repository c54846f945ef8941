/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.format;

/**
 * Reads values written by {@link BitWriter} from a fixed window of a byte array.
 */
public final class BitReader {

    private final byte[] data;
    private final int offset;
    private final long limitBits;
    private long bitPosition;

    public BitReader(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IndexOutOfBoundsException("Window [" + offset + ", " + (offset + length)
                    + ") outside of " + data.length + " bytes");
        }
        this.data = data;
        this.offset = offset;
        this.limitBits = (long) length << 3;
    }

    public int read(int bits) {
        if (bits < 1 || bits > 32) {
            throw new IllegalArgumentException("Unsupported bit width: " + bits);
        }
        if (remainingBits() < bits) {
            throw new IllegalStateException("Bit stream underflow: need " + bits
                    + " bits, " + remainingBits() + " left");
        }
        int value = 0;
        for (int i = 0; i < bits; i++) {
            int b = data[offset + (int) (bitPosition >>> 3)];
            if (((b >>> (bitPosition & 7)) & 1) != 0) {
                value |= 1 << i;
            }
            bitPosition++;
        }
        return value;
    }

    public long remainingBits() {
        return limitBits - bitPosition;
    }

    /** True when every bit left in the window is zero. */
    public boolean remainderIsZero() {
        while (remainingBits() > 0) {
            int chunk = (int) Math.min(32, remainingBits());
            if (read(chunk) != 0) return false;
        }
        return true;
    }
}
