/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog.util;

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.util.HexFormat;

/**
 * Content IDs of stored fingerprints: xxHash64 of the compressed bytes as 16 lowercase hex digits.
 */
public final class ContentHash {

    public static final int HEX_LENGTH = 16;

    private static final XXHash64 XX_HASH = XXHashFactory.fastestInstance().hash64();
    private static final long SEED = 0x9747b28cL;

    private ContentHash() {}

    public static long hash64(byte[] data) {
        return XX_HASH.hash(data, 0, data.length, SEED);
    }

    public static String of(byte[] data) {
        return HexFormat.of().toHexDigits(hash64(data));
    }

    public static boolean isValid(String id) {
        if (id == null || id.length() != HEX_LENGTH) return false;
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) return false;
        }
        return true;
    }
}
