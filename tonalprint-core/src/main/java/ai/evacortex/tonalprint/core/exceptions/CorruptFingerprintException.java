/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.exceptions;

/**
 * Thrown when a compressed fingerprint blob is structurally inconsistent and cannot be
 * decoded without guessing. Decoding never returns a partial sequence.
 */
public class CorruptFingerprintException extends RuntimeException {
    public CorruptFingerprintException(String message) {
        super("Corrupt fingerprint: " + message);
    }

    public CorruptFingerprintException(String message, Throwable cause) {
        super("Corrupt fingerprint: " + message, cause);
    }
}
