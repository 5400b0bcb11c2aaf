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
import io.tstools.slotcorr.model.PairwiseDifferences;
import io.tstools.slotcorr.model.SlotEstimate;

import java.util.Objects;
import java.util.Optional;

/**
 * Nadaraya-Watson averaging of pairwise quantities around each lag slot.
 *
 * <h2>Per-slot estimate</h2>
 *
 * <p>For slot k with center {@code c = k * h} (h the slot width), every pair whose
 * lag lies within the window {@code |lag - c| < w * h} gets the weight
 * {@link GaussianKernel#slotWeight(double, double)}, and three weighted means are
 * formed:
 *
 * <pre>{@code
 * lag         = sum(W * lag)         / sum(W)
 * correntropy = sum(W * G(dx))       / sum(W)
 * crossTerm   = sum(W * x_i * x_j)   / sum(W)
 * }</pre>
 *
 * <p>The window multiple w is 5 by default. Weights beyond it are negligible and
 * skipping them keeps a slot's cost proportional to the pairs near its center.
 * With truncation disabled every pair contributes.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Slots are independent and an averager holds no mutable state after
 * construction, so {@link #estimate(int)} may be called concurrently.
 */
public final class SlotAverager {

    /** Default window half-width, in slot widths. */
    public static final double DEFAULT_WINDOW_MULTIPLE = 5.0;

    private final PairwiseDifferences pairs;
    private final KernelBandwidths bandwidths;
    private final double windowRadius;
    private final boolean truncated;
    private final double[] correntropy;

    /**
     * Creates an averager with the default truncated window.
     */
    public SlotAverager(PairwiseDifferences pairs, KernelBandwidths bandwidths) {
        this(pairs, bandwidths, DEFAULT_WINDOW_MULTIPLE);
    }

    /**
     * Creates an averager.
     *
     * @param pairs lag-sorted pairwise differences
     * @param bandwidths slot grid and correntropy bandwidth
     * @param windowMultiple window half-width in slot widths, or
     *                       {@link Double#POSITIVE_INFINITY} to weight every pair
     */
    public SlotAverager(PairwiseDifferences pairs, KernelBandwidths bandwidths, double windowMultiple) {
        this.pairs = Objects.requireNonNull(pairs, "pairs cannot be null");
        this.bandwidths = Objects.requireNonNull(bandwidths, "bandwidths cannot be null");
        if (!(windowMultiple > 0)) {
            throw new IllegalArgumentException("windowMultiple must be positive, got " + windowMultiple);
        }
        if (!(bandwidths.bandwidth() > 0)) {
            throw new IllegalArgumentException("correntropy bandwidth must be positive, got " + bandwidths.bandwidth());
        }
        this.truncated = !Double.isInfinite(windowMultiple);
        this.windowRadius = truncated ? windowMultiple * bandwidths.slotWidth() : Double.POSITIVE_INFINITY;

        double sigma = bandwidths.bandwidth();
        this.correntropy = new double[pairs.size()];
        for (int i = 0; i < correntropy.length; i++) {
            correntropy[i] = GaussianKernel.correntropy(pairs.valueDifference(i), sigma);
        }
    }

    /**
     * Estimates slot {@code k}.
     *
     * @param k slot index, {@code 0 <= k <= maxLagIndex}
     * @return the estimate, or empty when no pair carries weight in the slot's window
     */
    public Optional<SlotEstimate> estimate(int k) {
        if (k < 0 || k > bandwidths.maxLagIndex()) {
            throw new IndexOutOfBoundsException(
                "slot " + k + " outside 0.." + bandwidths.maxLagIndex());
        }

        double center = bandwidths.slotCenter(k);
        double width = bandwidths.slotWidth();
        int size = pairs.size();

        double weightSum = 0;
        double lagSum = 0;
        double correntropySum = 0;
        double productSum = 0;
        int support = 0;

        for (int i = firstInWindow(center); i < size; i++) {
            double offset = pairs.lag(i) - center;
            if (offset >= windowRadius) {
                break;
            }
            double w = GaussianKernel.slotWeight(offset, width);
            weightSum += w;
            lagSum += w * pairs.lag(i);
            correntropySum += w * correntropy[i];
            productSum += w * pairs.product(i);
            support++;
        }

        if (support == 0 || !(weightSum > 0)) {
            return Optional.empty();
        }

        return Optional.of(new SlotEstimate(
            k,
            lagSum / weightSum,
            correntropySum / weightSum,
            productSum / weightSum,
            support));
    }

    public boolean isTruncated() {
        return truncated;
    }

    /// Index of the first pair with lag - center > -radius. Lags are sorted and
    /// the offset is monotone in the lag, so the window is one contiguous run.
    private int firstInWindow(double center) {
        if (!truncated) {
            return 0;
        }
        int start = pairs.lowerBound(center - windowRadius);
        while (start > 0 && pairs.lag(start - 1) - center > -windowRadius) {
            start--;
        }
        while (start < pairs.size() && !(pairs.lag(start) - center > -windowRadius)) {
            start++;
        }
        return start;
    }
}
