/*
 * TonalPrint — Audio Fingerprint Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tonalprint.core.engine;

class SequentialMatcherTest extends SegmentMatcherContractTest {

    private final SegmentMatcher matcher = new OffsetVotingMatcher(MatcherOptions.defaultOptions().sequential());

    @Override
    protected SegmentMatcher matcher() {
        return matcher;
    }
}
