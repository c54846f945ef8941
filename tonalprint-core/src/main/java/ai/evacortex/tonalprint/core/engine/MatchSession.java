/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

import ai.evacortex.tonalprint.core.FingerprintAlgorithm;
import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.exceptions.AlgorithmMismatchException;
import ai.evacortex.tonalprint.core.exceptions.InvalidMatchInputException;
import ai.evacortex.tonalprint.core.io.codec.FingerprintCodec;
import ai.evacortex.tonalprint.core.result.MatchSegment;
import ai.evacortex.tonalprint.core.result.SegmentPosition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Holds two fingerprints of one algorithm, runs the matcher over them and answers queries about
 * the segments found.
 *
 * <p>Life cycle: {@code NEW} until both fingerprints are set, {@code READY} when they are,
 * {@code MATCHED} after {@link #run()}, and {@code CLOSED} after {@link #close()}. Replacing a
 * fingerprint after a run returns the session to {@code READY} and drops the old segments.
 * Segment queries are only valid in {@code MATCHED}.</p>
 *
 * <p>A session is confined to one thread at a time.</p>
 */
public final class MatchSession implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(MatchSession.class);

    public enum State { NEW, READY, MATCHED, CLOSED }

    private final FingerprintAlgorithm algorithm;
    private final SegmentMatcher matcher;
    private final FingerprintSequence[] fingerprints = new FingerprintSequence[2];
    private List<MatchSegment> segments = List.of();
    private State state = State.NEW;

    public MatchSession(FingerprintAlgorithm algorithm) {
        this(algorithm, new OffsetVotingMatcher());
    }

    public MatchSession(FingerprintAlgorithm algorithm, SegmentMatcher matcher) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    public static MatchSession open(int algorithmId) {
        return new MatchSession(FingerprintAlgorithm.fromId(algorithmId));
    }

    /**
     * Sets fingerprint {@code idx} from its printable compressed form.
     *
     * @throws AlgorithmMismatchException if the fingerprint was produced by another algorithm
     */
    public void setFingerprint(int idx, String encoded) {
        ensureOpen();
        checkSlot(idx);
        Objects.requireNonNull(encoded, "encoded fingerprint must not be null");
        install(idx, FingerprintCodec.decodeText(encoded, algorithm.id()));
    }

    public void setRawFingerprint(int idx, int[] values) {
        ensureOpen();
        checkSlot(idx);
        Objects.requireNonNull(values, "values must not be null");
        install(idx, new FingerprintSequence(algorithm.id(), values));
    }

    public void setFingerprint(int idx, FingerprintSequence sequence) {
        ensureOpen();
        checkSlot(idx);
        Objects.requireNonNull(sequence, "sequence must not be null");
        if (sequence.algorithm() != algorithm.id()) {
            throw new AlgorithmMismatchException(algorithm.id(), sequence.algorithm());
        }
        install(idx, sequence);
    }

    public void run() {
        ensureOpen();
        for (int i = 0; i < fingerprints.length; i++) {
            if (fingerprints[i] == null || fingerprints[i].isEmpty()) {
                throw new InvalidMatchInputException("fingerprint " + i + " is empty");
            }
        }
        segments = List.copyOf(matcher.match(fingerprints[0], fingerprints[1]));
        state = State.MATCHED;
        LOG.debug("Session on {} found {} segments", algorithm, segments.size());
    }

    public int segmentCount() {
        ensureMatched();
        return segments.size();
    }

    public List<MatchSegment> segments() {
        ensureMatched();
        return segments;
    }

    public MatchSegment segment(int idx) {
        ensureMatched();
        if (idx < 0 || idx >= segments.size()) {
            throw new InvalidMatchInputException("segment index " + idx + " out of range [0, " + segments.size() + ")");
        }
        return segments.get(idx);
    }

    public SegmentPosition segmentPosition(int idx) {
        return segment(idx).position();
    }

    public SegmentPosition segmentPositionMillis(int idx) {
        return segment(idx).positionMillis(algorithm);
    }

    public int segmentScore(int idx) {
        return segment(idx).normalizedScore();
    }

    public FingerprintAlgorithm algorithm() {
        return algorithm;
    }

    public State state() {
        return state;
    }

    @Override
    public void close() {
        fingerprints[0] = null;
        fingerprints[1] = null;
        segments = List.of();
        state = State.CLOSED;
    }

    private void install(int idx, FingerprintSequence sequence) {
        fingerprints[idx] = sequence;
        segments = List.of();
        state = (fingerprints[0] != null && fingerprints[1] != null) ? State.READY : State.NEW;
    }

    private static void checkSlot(int idx) {
        if (idx < 0 || idx > 1) {
            throw new InvalidMatchInputException("fingerprint index can be only 0 or 1, got " + idx);
        }
    }

    private void ensureOpen() {
        if (state == State.CLOSED) throw new IllegalStateException("Match session is closed");
    }

    private void ensureMatched() {
        ensureOpen();
        if (state != State.MATCHED) throw new IllegalStateException("Match session has not been run");
    }
}
