package io.tstools.slotcorr.estimate;

/*
 * Copyright (c) tstools
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tstools.slotcorr.model.KernelBandwidths;

/**
 * Derives the lag slot grid from the time axis of a series.
 *
 * <pre>{@code
 * meanResolution = span / N
 * slotWidth      = slotWidthFraction * meanResolution
 * maxLagIndex    = floor(lagSpanFraction * span / slotWidth)
 * }</pre>
 *
 * <p>Slots {@code 0..maxLagIndex} are evaluated, centered at {@code k * slotWidth},
 * so estimates cover the first {@code lagSpanFraction} of the observed span.
 */
public final class SlotSizing {

    private SlotSizing() {
        // Utility class
    }

    /**
     * Sizes the slot grid and pairs it with a correntropy bandwidth.
     *
     * @param bandwidth correntropy kernel bandwidth sigma
     * @param span observed time span, must be positive
     * @param sampleCount number of samples N, must be positive
     * @param slotWidthFraction slot width as a fraction of the mean sampling resolution
     * @param lagSpanFraction fraction of the span covered by the slots
     * @return the kernel widths for the run
     */
    public static KernelBandwidths size(double bandwidth, double span, int sampleCount,
                                        double slotWidthFraction, double lagSpanFraction) {
        if (!(span > 0) || Double.isInfinite(span)) {
            throw new IllegalArgumentException("span must be positive and finite, got " + span);
        }
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive, got " + sampleCount);
        }
        if (!(slotWidthFraction > 0)) {
            throw new IllegalArgumentException("slotWidthFraction must be positive, got " + slotWidthFraction);
        }
        if (!(lagSpanFraction > 0)) {
            throw new IllegalArgumentException("lagSpanFraction must be positive, got " + lagSpanFraction);
        }

        double meanResolution = span / sampleCount;
        double slotWidth = slotWidthFraction * meanResolution;
        if (!(slotWidth > 0)) {
            throw new IllegalArgumentException(String.format(
                "slot width underflows to %s for span %s and %d samples", slotWidth, span, sampleCount));
        }

        double maxLag = Math.floor(lagSpanFraction * span / slotWidth);
        if (maxLag >= Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format(
                "%.0f lag slots requested; lower lagSpanFraction or raise slotWidthFraction", maxLag));
        }

        return new KernelBandwidths(bandwidth, meanResolution, slotWidth, (int) maxLag);
    }
}
