/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ContentHashTest {

    @Test
    void hexId_isStableAndWellFormed() {
        byte[] data = "fingerprint".getBytes(StandardCharsets.UTF_8);
        String id = ContentHash.of(data);
        assertEquals(ContentHash.HEX_LENGTH, id.length());
        assertTrue(ContentHash.isValid(id));
        assertEquals(id, ContentHash.of(data.clone()));
        assertEquals(Long.parseUnsignedLong(id, 16), ContentHash.hash64(data));
    }

    @Test
    void differentContent_differentId() {
        assertNotEquals(ContentHash.of(new byte[]{1, 0, 0, 0}), ContentHash.of(new byte[]{2, 0, 0, 0}));
    }

    @Test
    void malformedIds_rejected() {
        assertFalse(ContentHash.isValid(null));
        assertFalse(ContentHash.isValid("abc"));
        assertFalse(ContentHash.isValid("0123456789ABCDEF"));
        assertFalse(ContentHash.isValid("0123456789abcdeg"));
        assertTrue(ContentHash.isValid("0123456789abcdef"));
    }
}
