/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog;

import ai.evacortex.tonalprint.core.engine.MatcherOptions;
import ai.evacortex.tonalprint.core.math.SimilaritySignature;

import java.util.Objects;

/**
 * Settings of a {@link FingerprintCatalog}.
 *
 * @param cacheSize            number of decoded fingerprints kept in memory
 * @param maxSignatureDistance entries whose signature differs from the query's in more bits are
 *                             skipped; {@code 32} disables the pre-filter
 * @param matcherOptions       thresholds used when aligning the query with each entry
 */
public record CatalogOptions(int cacheSize, int maxSignatureDistance, MatcherOptions matcherOptions) {

    private static final int DEFAULT_CACHE_SIZE =
            Integer.parseInt(System.getProperty("tonalprint.catalog.cacheSize", "1024"));
    private static final int DEFAULT_MAX_SIGNATURE_DISTANCE =
            Integer.parseInt(System.getProperty("tonalprint.catalog.maxSignatureDistance", "12"));

    public CatalogOptions {
        if (cacheSize < 1)
            throw new IllegalArgumentException("cacheSize must be positive: " + cacheSize);
        if (maxSignatureDistance < 0 || maxSignatureDistance > SimilaritySignature.BITS)
            throw new IllegalArgumentException("maxSignatureDistance must be in [0, 32]: " + maxSignatureDistance);
        Objects.requireNonNull(matcherOptions, "matcherOptions must not be null");
    }

    public static CatalogOptions defaultOptions() {
        return new CatalogOptions(DEFAULT_CACHE_SIZE, DEFAULT_MAX_SIGNATURE_DISTANCE, MatcherOptions.defaultOptions());
    }

    public CatalogOptions withCacheSize(int value) {
        return new CatalogOptions(value, maxSignatureDistance, matcherOptions);
    }

    public CatalogOptions withMaxSignatureDistance(int value) {
        return new CatalogOptions(cacheSize, value, matcherOptions);
    }

    public CatalogOptions withMatcherOptions(MatcherOptions value) {
        return new CatalogOptions(cacheSize, maxSignatureDistance, value);
    }
}
