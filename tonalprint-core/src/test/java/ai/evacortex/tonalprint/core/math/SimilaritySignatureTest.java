/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.math;

import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.FingerprintTestUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilaritySignatureTest {

    @Test
    void emptySequence_hasZeroSignature() {
        assertEquals(0, SimilaritySignature.compute(FingerprintSequence.empty(1)));
        assertEquals(0, SimilaritySignature.compute(new int[0]));
    }

    @Test
    void singleElement_isItsOwnSignature() {
        assertEquals(0xDEADBEEF, SimilaritySignature.compute(new int[]{0xDEADBEEF}));
    }

    @Test
    void majorityWins_tiesFavourZero() {
        assertEquals(0b1, SimilaritySignature.compute(new int[]{0b1, 0b1, 0b0}));
        assertEquals(0b0, SimilaritySignature.compute(new int[]{0b1, 0b0}));
        assertEquals(0x80000000, SimilaritySignature.compute(new int[]{0x80000000, 0x80000001, 0xC0000000}));
    }

    @Test
    void signatureIsDeterministic() {
        FingerprintSequence seq = FingerprintTestUtils.randomSequence(500, 21);
        assertEquals(SimilaritySignature.compute(seq), SimilaritySignature.compute(seq));
        assertEquals(SimilaritySignature.compute(seq), SimilaritySignature.compute(seq.values()));
    }

    @Test
    void similarSequences_haveCloseSignatures() {
        int p = 0x5A3C0FF1;
        int q = 0xA1C3F00E;
        FingerprintSequence a = FingerprintTestUtils.noisyAround(p, 200, 3, 1);
        FingerprintSequence b = FingerprintTestUtils.noisyAround(p, 200, 3, 2);
        FingerprintSequence c = FingerprintTestUtils.noisyAround(q, 200, 3, 3);

        int sa = SimilaritySignature.compute(a);
        int sb = SimilaritySignature.compute(b);
        int sc = SimilaritySignature.compute(c);

        assertEquals(p, sa, "Noise must be voted out");
        assertEquals(0, SimilaritySignature.hammingDistance(sa, sb));
        assertTrue(SimilaritySignature.hammingDistance(sa, sc) > 16,
                "Unrelated sequences should be far apart");
    }

    @Test
    void hammingDistanceAndSimilarity() {
        assertEquals(0, SimilaritySignature.hammingDistance(123, 123));
        assertEquals(32, SimilaritySignature.hammingDistance(0, -1));
        assertEquals(2, SimilaritySignature.hammingDistance(0b1010, 0b0000));
        assertEquals(1.0, SimilaritySignature.similarity(7, 7), 1e-12);
        assertEquals(0.0, SimilaritySignature.similarity(0, -1), 1e-12);
        assertEquals(0.75, SimilaritySignature.similarity(0, 0xFF), 1e-12);
    }
}
