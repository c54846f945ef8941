/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core;

import ai.evacortex.tonalprint.core.exceptions.InvalidFingerprintException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintSequenceTest {

    @Test
    void valuesAreDefensivelyCopied() {
        int[] source = {1, 2, 3};
        FingerprintSequence seq = new FingerprintSequence(1, source);
        source[0] = 99;
        assertEquals(1, seq.get(0), "Constructor must copy the input array");

        int[] exposed = seq.values();
        exposed[1] = 99;
        assertEquals(2, seq.get(1), "Accessor must not expose internal state");
    }

    @Test
    void equalityIsValueBased() {
        assertEquals(FingerprintSequence.of(2, 1, 2, 3), FingerprintSequence.of(2, 1, 2, 3));
        assertEquals(FingerprintSequence.of(2, 1, 2, 3).hashCode(), FingerprintSequence.of(2, 1, 2, 3).hashCode());
        assertNotEquals(FingerprintSequence.of(2, 1, 2, 3), FingerprintSequence.of(1, 1, 2, 3));
        assertNotEquals(FingerprintSequence.of(2, 1, 2, 3), FingerprintSequence.of(2, 1, 2));
    }

    @Test
    void algorithmMustFitInOneByte() {
        assertThrows(InvalidFingerprintException.class, () -> FingerprintSequence.of(256, 1));
        assertThrows(InvalidFingerprintException.class, () -> FingerprintSequence.of(-1, 1));
        assertEquals(255, FingerprintSequence.of(255).algorithm());
    }

    @Test
    void comparabilityFollowsAlgorithm() {
        FingerprintSequence a = FingerprintSequence.of(1, 5);
        assertTrue(a.isComparableWith(FingerprintSequence.empty(1)));
        assertFalse(a.isComparableWith(FingerprintSequence.of(2, 5)));
        assertFalse(a.isComparableWith(null));
    }

    @Test
    void algorithmHopConvertsFramesToTime() {
        FingerprintAlgorithm v2 = FingerprintAlgorithm.fromId(1);
        assertEquals(FingerprintAlgorithm.V2, v2);
        assertEquals(1365.0 / 11025.0, v2.hopSeconds(), 1e-12);
        assertEquals(1238L, v2.framesToMillis(10));
        assertEquals(1024.0 / 11025.0, FingerprintAlgorithm.V5.hopSeconds(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> FingerprintAlgorithm.fromId(42));
    }

    @Test
    void versionStringHasThreeParts() {
        assertTrue(TonalPrintVersion.asString().matches("\\d+\\.\\d+\\.\\d+"));
    }
}
