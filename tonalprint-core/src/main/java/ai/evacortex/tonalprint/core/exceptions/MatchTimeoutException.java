/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.exceptions;

public class MatchTimeoutException extends RuntimeException {
    public MatchTimeoutException(String message) {
        super(message);
    }

    public MatchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
