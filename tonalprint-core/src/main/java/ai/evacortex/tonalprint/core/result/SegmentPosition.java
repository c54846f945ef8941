/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.result;

/**
 * Position triple of a segment, either in frames or in milliseconds depending on the producer.
 */
public record SegmentPosition(long positionA, long positionB, long duration) {}
