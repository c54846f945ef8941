/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.io.codec;

import ai.evacortex.tonalprint.core.exceptions.MalformedTextException;

import java.util.Base64;
import java.util.Objects;

/**
 * Printable form of arbitrary bytes using the URL-safe base64 alphabet
 * ({@code A-Z a-z 0-9 - _}). Output carries no padding; input is accepted with or without it.
 */
public final class TextCodec {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private TextCodec() {}

    public static String encode(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return ENCODER.encodeToString(data);
    }

    public static byte[] decode(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.length() % 4 == 1) {
            throw new MalformedTextException("Impossible length " + text.length());
        }
        try {
            return DECODER.decode(text);
        } catch (IllegalArgumentException e) {
            throw new MalformedTextException(e.getMessage(), e);
        }
    }

    public static int encodedLength(int byteCount) {
        return (byteCount * 4 + 2) / 3;
    }
}
