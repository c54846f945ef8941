/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog.storage;

import ai.evacortex.tonalprint.catalog.CatalogMatch;
import ai.evacortex.tonalprint.catalog.CatalogOptions;
import ai.evacortex.tonalprint.catalog.FingerprintCatalog;
import ai.evacortex.tonalprint.catalog.exceptions.DuplicateFingerprintException;
import ai.evacortex.tonalprint.catalog.exceptions.FingerprintNotFoundException;
import ai.evacortex.tonalprint.catalog.metadata.CatalogEntry;
import ai.evacortex.tonalprint.catalog.metadata.CatalogManifest;
import ai.evacortex.tonalprint.catalog.util.ContentHash;
import ai.evacortex.tonalprint.catalog.util.LockScope;
import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.engine.OffsetVotingMatcher;
import ai.evacortex.tonalprint.core.engine.SegmentMatcher;
import ai.evacortex.tonalprint.core.exceptions.InvalidFingerprintException;
import ai.evacortex.tonalprint.core.exceptions.InvalidMatchInputException;
import ai.evacortex.tonalprint.core.io.codec.FingerprintCodec;
import ai.evacortex.tonalprint.core.io.codec.TextCodec;
import ai.evacortex.tonalprint.core.math.SimilaritySignature;
import ai.evacortex.tonalprint.core.result.MatchSegment;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * File-backed {@link FingerprintCatalog}.
 *
 * <p>All entries live in {@code <root>/catalog/manifest.json}, which is rewritten after every
 * insertion and deletion. Decoded fingerprints are kept in a bounded cache and re-decoded from the
 * manifest on a miss. Queries align the candidates on a work-stealing pool, one entry per task;
 * each alignment runs its offset search on the worker that owns the entry.</p>
 */
public class FingerprintCatalogImpl implements FingerprintCatalog {

    private static final Logger LOG = LogManager.getLogger(FingerprintCatalogImpl.class);

    private final Path rootDir;
    private final CatalogOptions options;
    private final CatalogManifest manifest;
    private final LoadingCache<String, FingerprintSequence> sequences;
    private final SegmentMatcher matcher;

    private final ReadWriteLock globalLock = new ReentrantReadWriteLock();
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FingerprintCatalogImpl(Path root) {
        this(root, CatalogOptions.defaultOptions());
    }

    public FingerprintCatalogImpl(Path root, CatalogOptions options) {
        this.rootDir = Objects.requireNonNull(root, "root must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.manifest = CatalogManifest.loadOrCreate(root.resolve("catalog/manifest.json"));
        this.sequences = Caffeine.newBuilder()
                .maximumSize(options.cacheSize())
                .build(this::loadSequence);
        this.matcher = new OffsetVotingMatcher(options.matcherOptions().sequential());
        this.executor = Executors.newWorkStealingPool();
        LOG.info("Opened fingerprint catalog at {} with {} entries", rootDir, manifest.size());
    }

    @Override
    public String insert(FingerprintSequence sequence, Map<String, String> metadata) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (sequence.isEmpty()) {
            throw new InvalidFingerprintException("cannot catalog an empty fingerprint");
        }
        byte[] blob = FingerprintCodec.encode(sequence);
        String id = ContentHash.of(blob);

        try (LockScope ignored = LockScope.exclusive(globalLock)) {
            ensureOpen();
            if (manifest.contains(id)) {
                throw new DuplicateFingerprintException(id);
            }
            CatalogEntry entry = new CatalogEntry(sequence.algorithm(), sequence.length(),
                    SimilaritySignature.compute(sequence), TextCodec.encode(blob), metadata);
            manifest.put(id, entry);
            try {
                manifest.flush();
            } catch (RuntimeException e) {
                manifest.remove(id);
                throw e;
            }
            sequences.put(id, sequence);
            LOG.debug("Inserted fingerprint {} ({} frames, algorithm {})", id, sequence.length(), sequence.algorithm());
            return id;
        }
    }

    @Override
    public String insertEncoded(String encoded, Map<String, String> metadata) {
        Objects.requireNonNull(encoded, "encoded fingerprint must not be null");
        return insert(FingerprintCodec.decodeText(encoded), metadata);
    }

    @Override
    public void delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try (LockScope ignored = LockScope.exclusive(globalLock)) {
            ensureOpen();
            CatalogEntry removed = manifest.remove(id);
            if (removed == null) throw new FingerprintNotFoundException(id);
            try {
                manifest.flush();
            } catch (RuntimeException e) {
                manifest.put(id, removed);
                throw e;
            }
            sequences.invalidate(id);
            LOG.debug("Deleted fingerprint {}", id);
        }
    }

    @Override
    public FingerprintSequence get(String id) {
        try (LockScope ignored = LockScope.shared(globalLock)) {
            ensureOpen();
            if (id == null || !manifest.contains(id)) throw new FingerprintNotFoundException(id);
            return sequences.get(id);
        }
    }

    @Override
    public Map<String, String> metadata(String id) {
        try (LockScope ignored = LockScope.shared(globalLock)) {
            ensureOpen();
            CatalogEntry entry = id == null ? null : manifest.get(id);
            if (entry == null) throw new FingerprintNotFoundException(id);
            return new HashMap<>(entry.metadata());
        }
    }

    @Override
    public Optional<String> findExact(FingerprintSequence sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        if (sequence.isEmpty()) return Optional.empty();
        String id = ContentHash.of(FingerprintCodec.encode(sequence));
        try (LockScope ignored = LockScope.shared(globalLock)) {
            ensureOpen();
            return manifest.contains(id) ? Optional.of(id) : Optional.empty();
        }
    }

    @Override
    public List<CatalogMatch> query(FingerprintSequence sequence, int topK) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        if (topK < 1) throw new IllegalArgumentException("topK must be positive: " + topK);
        if (sequence.isEmpty()) throw new InvalidMatchInputException("query fingerprint is empty");

        try (LockScope ignored = LockScope.shared(globalLock)) {
            ensureOpen();
            int signature = SimilaritySignature.compute(sequence);
            List<String> candidates = new ArrayList<>();
            for (Map.Entry<String, CatalogEntry> e : manifest.snapshot().entrySet()) {
                CatalogEntry entry = e.getValue();
                if (entry.algorithm() != sequence.algorithm()) continue;
                if (SimilaritySignature.hammingDistance(signature, entry.signature()) > options.maxSignatureDistance()) continue;
                candidates.add(e.getKey());
            }
            if (candidates.isEmpty()) {
                LOG.debug("Query of {} frames: no candidates after pre-filter", sequence.length());
                return List.of();
            }

            ForkJoinPool pool = (ForkJoinPool) executor;
            List<CatalogMatch> matches = pool.invoke(new CandidateMatchTask(candidates, sequence, 0, candidates.size()));
            matches.sort(CatalogMatch.RANKING);
            LOG.debug("Query of {} frames: {} candidates, {} matches", sequence.length(), candidates.size(), matches.size());
            return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : List.copyOf(matches);
        }
    }

    @Override
    public int size() {
        return manifest.size();
    }

    @Override
    public Set<String> ids() {
        return manifest.getAllIds();
    }

    public CatalogOptions options() {
        return options;
    }

    @Override
    public void close() {
        try (LockScope ignored = LockScope.exclusive(globalLock)) {
            if (!closed.compareAndSet(false, true)) return;
            shutdownExecutor();
            sequences.invalidateAll();
            sequences.cleanUp();
            manifest.flush();
            LOG.info("Closed fingerprint catalog at {} with {} entries", rootDir, manifest.size());
        }
    }

    private FingerprintSequence loadSequence(String id) {
        CatalogEntry entry = manifest.get(id);
        if (entry == null) throw new FingerprintNotFoundException(id);
        return FingerprintCodec.decodeText(entry.fingerprint(), entry.algorithm());
    }

    private List<MatchSegment> alignWith(FingerprintSequence query, String id) {
        return matcher.match(query, sequences.get(id));
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("Fingerprint catalog is closed");
    }

    private void shutdownExecutor() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private class CandidateMatchTask extends RecursiveTask<List<CatalogMatch>> {
        private final List<String> ids;
        private final FingerprintSequence query;
        private final int from;
        private final int to;

        CandidateMatchTask(List<String> ids, FingerprintSequence query, int from, int to) {
            this.ids = ids;
            this.query = query;
            this.from = from;
            this.to = to;
        }

        @Override
        protected List<CatalogMatch> compute() {
            if (to - from <= 1) {
                List<CatalogMatch> results = new ArrayList<>();
                for (int i = from; i < to; i++) {
                    String id = ids.get(i);
                    List<MatchSegment> segments = alignWith(query, id);
                    if (!segments.isEmpty()) {
                        results.add(CatalogMatch.of(id, segments));
                    }
                }
                return results;
            }
            int mid = (from + to) >>> 1;
            CandidateMatchTask left = new CandidateMatchTask(ids, query, from, mid);
            CandidateMatchTask right = new CandidateMatchTask(ids, query, mid, to);
            left.fork();
            List<CatalogMatch> rightResult = right.compute();
            List<CatalogMatch> leftResult = left.join();
            leftResult.addAll(rightResult);
            return leftResult;
        }
    }
}
