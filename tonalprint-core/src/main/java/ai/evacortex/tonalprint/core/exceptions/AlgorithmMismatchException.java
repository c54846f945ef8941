/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.exceptions;

public class AlgorithmMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public AlgorithmMismatchException(int expected, int actual) {
        super("Fingerprint algorithm mismatch: expected " + expected + ", found " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
