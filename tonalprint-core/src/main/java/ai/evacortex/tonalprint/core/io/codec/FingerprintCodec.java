/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.codec;

import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.exceptions.AlgorithmMismatchException;
import ai.evacortex.tonalprint.core.exceptions.CorruptFingerprintException;
import ai.evacortex.tonalprint.core.exceptions.InvalidFingerprintException;
import ai.evacortex.tonalprint.core.io.format.BitReader;
import ai.evacortex.tonalprint.core.io.format.BitWriter;
import ai.evacortex.tonalprint.core.io.format.FingerprintHeader;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Codec for turning a {@link FingerprintSequence} into a compact binary blob and back.
 *
 * <h3>Encoding</h3>
 * Each sub-fingerprint is XORed with its predecessor (the first one with zero). Consecutive
 * frames of locally stationary audio differ in few bits, so most deltas map to a 3-bit code
 * from {@link DeltaCodeTable}. Deltas without a short code are emitted as the escape code and
 * appended in full to an exception list.
 *
 * <h3>Layout</h3>
 * <ul>
 *   <li>{@link FingerprintHeader}: algorithm id and element count</li>
 *   <li>packed codes, least-significant bit first, zero-padded to a byte boundary</li>
 *   <li>exception deltas, 4 bytes each, in emission order</li>
 * </ul>
 *
 * <h3>Decoding</h3>
 * Decoding is all-or-nothing. Any inconsistency between the packed stream and the exception
 * list raises {@link CorruptFingerprintException}; no partial sequence is returned.
 *
 * @see TextCodec
 * @see DeltaCodeTable
 */
public final class FingerprintCodec {

    public static final int EXCEPTION_LENGTH = Integer.BYTES;

    private FingerprintCodec() {}

    public static byte[] encode(FingerprintSequence sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        int count = sequence.length();
        if (count > FingerprintHeader.MAX_ELEMENT_COUNT) {
            throw new InvalidFingerprintException("Sequence too long to encode: " + count);
        }

        int[] values = sequence.values();
        BitWriter codes = new BitWriter(FingerprintHeader.packedLength(count, DeltaCodeTable.CODE_BITS));
        int[] exceptions = new int[count];
        int exceptionCount = 0;

        int previous = 0;
        for (int value : values) {
            int delta = previous ^ value;
            int code = DeltaCodeTable.codeFor(delta);
            codes.write(code, DeltaCodeTable.CODE_BITS);
            if (DeltaCodeTable.isEscape(code)) {
                exceptions[exceptionCount++] = delta;
            }
            previous = value;
        }

        byte[] packed = codes.toByteArray();
        ByteBuffer buf = ByteBuffer
                .allocate(FingerprintHeader.SIZE + packed.length + exceptionCount * EXCEPTION_LENGTH)
                .order(FingerprintHeader.ORDER);
        new FingerprintHeader(sequence.algorithm(), count).writeTo(buf);
        buf.put(packed);
        for (int i = 0; i < exceptionCount; i++) {
            buf.putInt(exceptions[i]);
        }
        return buf.array();
    }

    public static FingerprintSequence decode(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        ByteBuffer buf = ByteBuffer.wrap(data).order(FingerprintHeader.ORDER);
        FingerprintHeader header = FingerprintHeader.readFrom(buf);

        int count = header.elementCount();
        int packedLength = FingerprintHeader.packedLength(count, DeltaCodeTable.CODE_BITS);
        if (buf.remaining() < packedLength) {
            throw new CorruptFingerprintException("Packed stream truncated: need " + packedLength
                    + " bytes for " + count + " codes, found " + buf.remaining());
        }

        BitReader reader = new BitReader(data, buf.position(), packedLength);
        int[] codes = new int[count];
        int escapes = 0;
        for (int i = 0; i < count; i++) {
            codes[i] = reader.read(DeltaCodeTable.CODE_BITS);
            if (DeltaCodeTable.isEscape(codes[i])) escapes++;
        }
        if (!reader.remainderIsZero()) {
            throw new CorruptFingerprintException("Non-zero padding after packed stream");
        }
        buf.position(buf.position() + packedLength);

        long expectedExceptionBytes = (long) escapes * EXCEPTION_LENGTH;
        if (buf.remaining() < expectedExceptionBytes) {
            throw new CorruptFingerprintException("Exception list truncated: " + escapes
                    + " escape codes need " + expectedExceptionBytes + " bytes, found " + buf.remaining());
        }
        if (buf.remaining() != expectedExceptionBytes) {
            throw new CorruptFingerprintException("Packed stream length inconsistent with exception count: "
                    + buf.remaining() + " trailing bytes for " + escapes + " exceptions");
        }

        int[] values = new int[count];
        int previous = 0;
        for (int i = 0; i < count; i++) {
            int delta = DeltaCodeTable.isEscape(codes[i])
                    ? buf.getInt()
                    : DeltaCodeTable.deltaFor(codes[i]);
            previous ^= delta;
            values[i] = previous;
        }
        return new FingerprintSequence(header.algorithm(), values);
    }

    public static FingerprintSequence decode(byte[] data, int expectedAlgorithm) {
        FingerprintSequence sequence = decode(data);
        if (sequence.algorithm() != expectedAlgorithm) {
            throw new AlgorithmMismatchException(expectedAlgorithm, sequence.algorithm());
        }
        return sequence;
    }

    public static String encodeText(FingerprintSequence sequence) {
        return TextCodec.encode(encode(sequence));
    }

    public static FingerprintSequence decodeText(String text) {
        return decode(TextCodec.decode(text));
    }

    public static FingerprintSequence decodeText(String text, int expectedAlgorithm) {
        return decode(TextCodec.decode(text), expectedAlgorithm);
    }

    /** Reads only the algorithm id of a blob without decoding its body. */
    public static int peekAlgorithm(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length < FingerprintHeader.SIZE) {
            throw new CorruptFingerprintException("Header needs " + FingerprintHeader.SIZE
                    + " bytes, found " + data.length);
        }
        return data[0] & 0xFF;
    }

    public static int encodedSize(FingerprintSequence sequence) {
        int exceptions = 0;
        int previous = 0;
        for (int value : sequence.values()) {
            if (DeltaCodeTable.isEscape(DeltaCodeTable.codeFor(previous ^ value))) exceptions++;
            previous = value;
        }
        return FingerprintHeader.SIZE
                + FingerprintHeader.packedLength(sequence.length(), DeltaCodeTable.CODE_BITS)
                + exceptions * EXCEPTION_LENGTH;
    }
}
