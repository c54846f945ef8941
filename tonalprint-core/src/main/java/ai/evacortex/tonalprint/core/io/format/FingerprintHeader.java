/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.format;

import ai.evacortex.tonalprint.core.exceptions.CorruptFingerprintException;
import ai.evacortex.tonalprint.core.exceptions.InvalidFingerprintException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed four-byte header at the start of every compressed fingerprint.
 *
 * <h3>Fields</h3>
 * <ul>
 *   <li>algorithm id (1 byte, unsigned)</li>
 *   <li>element count (3 bytes, unsigned, little-endian)</li>
 * </ul>
 *
 * <p>The element count tells the decoder where the zero-padded code stream ends and the
 * exception list begins.</p>
 */
public final class FingerprintHeader {

    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final int ALGORITHM_LENGTH = 1;
    public static final int COUNT_LENGTH = 3;
    public static final int SIZE = ALGORITHM_LENGTH + COUNT_LENGTH;
    public static final int MAX_ELEMENT_COUNT = (1 << 24) - 1;

    private final int algorithm;
    private final int elementCount;

    public FingerprintHeader(int algorithm, int elementCount) {
        if (algorithm < 0 || algorithm > 0xFF) {
            throw new InvalidFingerprintException("Algorithm id out of range: " + algorithm);
        }
        if (elementCount < 0 || elementCount > MAX_ELEMENT_COUNT) {
            throw new InvalidFingerprintException("Unsupported element count: " + elementCount);
        }
        this.algorithm = algorithm;
        this.elementCount = elementCount;
    }

    public void writeTo(ByteBuffer buf) {
        buf.put((byte) algorithm);
        buf.put((byte) (elementCount & 0xFF));
        buf.put((byte) ((elementCount >>> 8) & 0xFF));
        buf.put((byte) ((elementCount >>> 16) & 0xFF));
    }

    public static FingerprintHeader readFrom(ByteBuffer buf) {
        if (buf.remaining() < SIZE) {
            throw new CorruptFingerprintException("Header needs " + SIZE + " bytes, found " + buf.remaining());
        }
        int algorithm = buf.get() & 0xFF;
        int count = (buf.get() & 0xFF)
                | (buf.get() & 0xFF) << 8
                | (buf.get() & 0xFF) << 16;
        return new FingerprintHeader(algorithm, count);
    }

    /** Bytes occupied by {@code elementCount} codes of {@code codeBits} each, rounded up. */
    public static int packedLength(int elementCount, int codeBits) {
        return (int) (((long) elementCount * codeBits + 7) >>> 3);
    }

    public int algorithm()    { return algorithm; }
    public int elementCount() { return elementCount; }
}
