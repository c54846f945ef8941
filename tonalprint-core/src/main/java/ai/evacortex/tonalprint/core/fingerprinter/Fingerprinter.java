/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.fingerprinter;

import ai.evacortex.tonalprint.core.FingerprintAlgorithm;

/**
 * Source of sub-fingerprints: turns 16-bit PCM audio into a {@link ai.evacortex.tonalprint.core.FingerprintSequence}.
 * Spectral analysis lives behind this interface; this library only consumes its output.
 */
public interface Fingerprinter {

    /**
     * Opens a session for interleaved PCM at the given format.
     *
     * @throws IllegalArgumentException if the format is not supported
     */
    FingerprintSession open(int sampleRate, int channels, FingerprintAlgorithm algorithm);
}
