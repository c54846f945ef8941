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
import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.io.codec.FingerprintCodec;
import ai.evacortex.tonalprint.core.math.SimilaritySignature;

import java.util.Objects;

/**
 * Life-cycle handle around a {@link Fingerprinter}: {@link #start} opens a session,
 * {@link #feed} passes audio through, {@link #finish} collects the sequence. The result
 * accessors are only valid once finished; calling {@code start} again begins a new recording.
 */
public final class FingerprintContext {

    private final Fingerprinter fingerprinter;
    private final FingerprintAlgorithm algorithm;

    private FingerprintSession session;
    private FingerprintSequence fingerprint;

    public FingerprintContext(Fingerprinter fingerprinter, FingerprintAlgorithm algorithm) {
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
    }

    public void start(int sampleRate, int channels) {
        if (sampleRate <= 0) throw new IllegalArgumentException("Invalid sample rate: " + sampleRate);
        if (channels <= 0) throw new IllegalArgumentException("Invalid channel count: " + channels);
        fingerprint = null;
        session = fingerprinter.open(sampleRate, channels, algorithm);
    }

    public void feed(short[] pcm, int length) {
        if (session == null) throw new IllegalStateException("Fingerprinting has not been started");
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (length < 0 || length > pcm.length) {
            throw new IllegalArgumentException("Invalid sample count " + length + " for buffer of " + pcm.length);
        }
        session.feed(pcm, length);
    }

    public void finish() {
        if (session == null) throw new IllegalStateException("Fingerprinting has not been started");
        FingerprintSequence produced = session.close();
        session = null;
        if (produced.algorithm() != algorithm.id()) {
            throw new IllegalStateException("Fingerprinter produced algorithm " + produced.algorithm()
                    + " for a " + algorithm + " session");
        }
        fingerprint = produced;
    }

    public boolean isFinished() {
        return fingerprint != null;
    }

    /** Compressed fingerprint in printable form. */
    public String fingerprint() {
        return FingerprintCodec.encodeText(finished());
    }

    public int[] rawFingerprint() {
        return finished().values();
    }

    public FingerprintSequence sequence() {
        return finished();
    }

    public int fingerprintHash() {
        return SimilaritySignature.compute(finished());
    }

    public FingerprintAlgorithm algorithm() {
        return algorithm;
    }

    private FingerprintSequence finished() {
        if (fingerprint == null) throw new IllegalStateException("Fingerprint is not finished");
        return fingerprint;
    }
}
