/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.fingerprinter;

import ai.evacortex.tonalprint.core.FingerprintSequence;

public interface FingerprintSession {

    /** Consumes the first {@code length} interleaved samples of {@code pcm}. */
    void feed(short[] pcm, int length);

    /** Flushes buffered audio and returns the sub-fingerprints of everything fed. */
    FingerprintSequence close();
}
