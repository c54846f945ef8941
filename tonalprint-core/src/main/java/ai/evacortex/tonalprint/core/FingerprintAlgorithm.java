/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core;

import java.time.Duration;

/**
 * Feature-extraction configurations known to this library, with the hop between consecutive
 * sub-fingerprints. The hop is only used to turn frame indices into elapsed time; matching
 * itself works in frames.
 */
public enum FingerprintAlgorithm {

    V1(0, 11_025, 1365),
    V2(1, 11_025, 1365),
    V3(2, 11_025, 1365),
    V4(3, 11_025, 1365),
    V5(4, 11_025, 1024);

    public static final FingerprintAlgorithm DEFAULT = V2;

    private final int id;
    private final int sampleRate;
    private final int hopSamples;

    FingerprintAlgorithm(int id, int sampleRate, int hopSamples) {
        this.id = id;
        this.sampleRate = sampleRate;
        this.hopSamples = hopSamples;
    }

    public int id()         { return id; }
    public int sampleRate() { return sampleRate; }
    public int hopSamples() { return hopSamples; }

    public double hopSeconds() {
        return (double) hopSamples / sampleRate;
    }

    public Duration hopDuration() {
        return Duration.ofNanos(Math.round(hopSeconds() * 1_000_000_000d));
    }

    public double framesToSeconds(int frames) {
        return frames * hopSeconds();
    }

    public long framesToMillis(int frames) {
        return Math.round(1000 * framesToSeconds(frames));
    }

    public static FingerprintAlgorithm fromId(int id) {
        for (FingerprintAlgorithm a : values()) {
            if (a.id == id) return a;
        }
        throw new IllegalArgumentException("Unknown fingerprint algorithm id: " + id);
    }
}
