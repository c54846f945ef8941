/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog;

import ai.evacortex.tonalprint.catalog.exceptions.DuplicateFingerprintException;
import ai.evacortex.tonalprint.catalog.exceptions.FingerprintNotFoundException;
import ai.evacortex.tonalprint.core.FingerprintSequence;
import ai.evacortex.tonalprint.core.exceptions.AlgorithmMismatchException;
import ai.evacortex.tonalprint.core.exceptions.InvalidFingerprintException;
import ai.evacortex.tonalprint.core.exceptions.InvalidMatchInputException;
import ai.evacortex.tonalprint.core.exceptions.MalformedTextException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code FingerprintCatalog} defines the contract of a persistent, content-addressed collection
 * of audio fingerprints that can be searched for recordings sharing material with a query.
 *
 * <p>Each stored fingerprint is identified by the 64-bit xxHash of its compressed form, written as
 * 16 lowercase hex digits. The ID depends only on the content, so the same fingerprint can never
 * be stored twice, and the ID stays stable across restarts.</p>
 *
 * <p>Queries first narrow the catalog to entries of the query's algorithm whose similarity
 * signature is close to the query's, and then align each remaining entry with the query frame by
 * frame. Results are deterministic for identical catalog contents and query.</p>
 *
 * <p>Implementations must be safe for concurrent use: queries may run in parallel with each other,
 * while insertions and deletions are exclusive.</p>
 *
 * @see CatalogMatch
 */
public interface FingerprintCatalog extends AutoCloseable {

    /**
     * Stores a fingerprint together with free-form metadata.
     *
     * @param sequence the fingerprint to store, must not be empty
     * @param metadata key/value pairs kept alongside the fingerprint, may be empty
     * @return the content-derived ID of the stored fingerprint
     * @throws DuplicateFingerprintException if the same fingerprint is already stored
     * @throws InvalidFingerprintException   if the fingerprint is empty or cannot be encoded
     */
    String insert(FingerprintSequence sequence, Map<String, String> metadata);

    /**
     * Stores a fingerprint given in its printable compressed form.
     *
     * @throws MalformedTextException        if the text is not valid
     * @throws DuplicateFingerprintException if the same fingerprint is already stored
     */
    String insertEncoded(String encoded, Map<String, String> metadata);

    /**
     * Removes a stored fingerprint.
     *
     * @throws FingerprintNotFoundException if no fingerprint has this ID
     */
    void delete(String id);

    /**
     * @throws FingerprintNotFoundException if no fingerprint has this ID
     */
    FingerprintSequence get(String id);

    /**
     * @return a copy of the metadata stored with the fingerprint
     * @throws FingerprintNotFoundException if no fingerprint has this ID
     */
    Map<String, String> metadata(String id);

    /**
     * Looks up a fingerprint by content.
     *
     * @return the ID of the identical stored fingerprint, or empty if there is none
     */
    Optional<String> findExact(FingerprintSequence sequence);

    /**
     * Finds stored fingerprints that share at least one matching segment with the query.
     *
     * <p>Matches are ordered by best segment score (descending), then by the number of frames
     * covered by all segments (descending), then by ID. Entries of other algorithms are never
     * considered, so a query never fails with {@link AlgorithmMismatchException}.</p>
     *
     * @param sequence the query fingerprint, must not be empty
     * @param topK     maximum number of matches to return, must be positive
     * @throws InvalidMatchInputException if the query is empty
     */
    List<CatalogMatch> query(FingerprintSequence sequence, int topK);

    int size();

    Set<String> ids();

    /** Flushes pending state and releases worker threads. */
    @Override
    void close();
}
