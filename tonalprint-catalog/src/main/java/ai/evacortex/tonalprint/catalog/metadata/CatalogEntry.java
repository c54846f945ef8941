/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.catalog.metadata;

import java.util.Map;

/**
 * Persisted description of one stored fingerprint.
 *
 * @param algorithm   algorithm id of the fingerprint
 * @param length      number of sub-fingerprints
 * @param signature   similarity signature used by the query pre-filter
 * @param fingerprint compressed fingerprint in printable form
 * @param metadata    caller-supplied key/value pairs
 */
public record CatalogEntry(int algorithm, int length, int signature, String fingerprint, Map<String, String> metadata) {

    public CatalogEntry {
        if (fingerprint == null || fingerprint.isEmpty()) {
            throw new IllegalArgumentException("Catalog entry without fingerprint");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
