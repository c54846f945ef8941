/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.format;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class BitWriterReaderTest {

    @Test
    void mixedWidths_readBackInOrder() {
        BitWriter writer = new BitWriter(1);
        writer.write(0b101, 3);
        writer.write(0xABCDEF12, 32);
        writer.write(0, 1);
        writer.write(0x7F, 7);
        assertEquals(43, writer.bitLength());
        assertEquals(6, writer.byteLength());

        byte[] bytes = writer.toByteArray();
        BitReader reader = new BitReader(bytes, 0, bytes.length);
        assertEquals(0b101, reader.read(3));
        assertEquals(0xABCDEF12, reader.read(32));
        assertEquals(0, reader.read(1));
        assertEquals(0x7F, reader.read(7));
        assertEquals(5, reader.remainingBits());
        assertTrue(reader.remainderIsZero());
    }

    @Test
    void codesAreLeastSignificantBitFirst() {
        BitWriter writer = new BitWriter();
        writer.write(1, 3);
        writer.write(2, 3);
        writer.write(7, 3);
        assertArrayEquals(new byte[]{(byte) 0xD1, 0x01}, writer.toByteArray());
    }

    @Test
    void readerRespectsWindow() {
        byte[] data = {(byte) 0xFF, 0x05, (byte) 0xFF};
        BitReader reader = new BitReader(data, 1, 1);
        assertEquals(5, reader.read(3));
        assertThrows(IllegalStateException.class, () -> reader.read(6));
        assertThrows(IndexOutOfBoundsException.class, () -> new BitReader(data, 2, 2));
    }

    @Test
    void headerRoundTrip() {
        ByteBuffer buf = ByteBuffer.allocate(FingerprintHeader.SIZE);
        new FingerprintHeader(200, 0x123456).writeTo(buf);
        assertArrayEquals(new byte[]{(byte) 200, 0x56, 0x34, 0x12}, buf.array());
        buf.flip();
        FingerprintHeader header = FingerprintHeader.readFrom(buf);
        assertEquals(200, header.algorithm());
        assertEquals(0x123456, header.elementCount());
        assertEquals(3, FingerprintHeader.packedLength(8, 3));
        assertEquals(4, FingerprintHeader.packedLength(9, 3));
    }
}
