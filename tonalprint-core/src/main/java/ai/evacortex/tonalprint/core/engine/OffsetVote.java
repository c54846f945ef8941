/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

/**
 * Number of matching frame pairs found when the second sequence is shifted by {@code offset}:
 * frame {@code i} of the first sequence is paired with frame {@code i - offset} of the second.
 */
public record OffsetVote(int offset, int votes) {}
