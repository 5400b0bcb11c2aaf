package io.tstools.slotcorr.model;

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

import com.google.gson.annotations.SerializedName;
import io.tstools.slotcorr.config.SlotCorrGsonConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one slotted correntropy estimate.
 *
 * <h2>Contents</h2>
 *
 * <ul>
 *   <li><b>lag</b> - realized mean lag of each retained slot, non-decreasing</li>
 *   <li><b>correntropy</b> - kernel correntropy at that lag, in (0, 1]</li>
 *   <li><b>normalizedCrossTerm</b> - raw cross-product average divided by the
 *       sample variance of the values; close to 1 at lag 0 for a zero-mean series</li>
 *   <li><b>bandwidth</b> - the correntropy kernel bandwidth sigma</li>
 * </ul>
 *
 * <p>The three arrays always share length and index alignment. Slots whose
 * window held no pair are not represented. The remaining fields are
 * diagnostics of the run: slot width, the variance used for normalization, the
 * number of slots evaluated and the pair support of each retained slot.
 *
 * <p>Instances are immutable; every array accessor returns a copy.
 */
public final class CorrentropyResult {

    @SerializedName("lag")
    private final double[] lag;

    @SerializedName("correntropy")
    private final double[] correntropy;

    @SerializedName("bandwidth")
    private final double bandwidth;

    @SerializedName("normalized_cross_term")
    private final double[] normalizedCrossTerm;

    @SerializedName("slot_width")
    private final double slotWidth;

    @SerializedName("variance")
    private final double variance;

    @SerializedName("slots_evaluated")
    private final int slotsEvaluated;

    @SerializedName("support")
    private final int[] support;

    public CorrentropyResult(double[] lag, double[] correntropy, double bandwidth,
                             double[] normalizedCrossTerm, double slotWidth, double variance,
                             int slotsEvaluated, int[] support) {
        Objects.requireNonNull(lag, "lag cannot be null");
        Objects.requireNonNull(correntropy, "correntropy cannot be null");
        Objects.requireNonNull(normalizedCrossTerm, "normalizedCrossTerm cannot be null");
        Objects.requireNonNull(support, "support cannot be null");
        if (correntropy.length != lag.length || normalizedCrossTerm.length != lag.length
            || support.length != lag.length) {
            throw new IllegalArgumentException(String.format(
                "result arrays must be aligned: lag=%d, correntropy=%d, normalizedCrossTerm=%d, support=%d",
                lag.length, correntropy.length, normalizedCrossTerm.length, support.length));
        }
        this.lag = lag.clone();
        this.correntropy = correntropy.clone();
        this.bandwidth = bandwidth;
        this.normalizedCrossTerm = normalizedCrossTerm.clone();
        this.slotWidth = slotWidth;
        this.variance = variance;
        this.slotsEvaluated = slotsEvaluated;
        this.support = support.clone();
    }

    /**
     * Compacts per-slot estimates into a result.
     *
     * <p>Empty slots are dropped, the rest keep their slot order. Each cross term
     * is divided by {@code variance}.
     *
     * @param slots one entry per evaluated slot, in slot order
     * @param bandwidths kernel widths of the run
     * @param variance sample variance of the original values, must be positive
     * @return the compacted result
     */
    public static CorrentropyResult fromSlots(List<Optional<SlotEstimate>> slots,
                                              KernelBandwidths bandwidths, double variance) {
        Objects.requireNonNull(slots, "slots cannot be null");
        Objects.requireNonNull(bandwidths, "bandwidths cannot be null");
        if (!(variance > 0)) {
            throw new IllegalArgumentException("variance must be positive, got " + variance);
        }

        List<SlotEstimate> defined = new ArrayList<>(slots.size());
        for (Optional<SlotEstimate> slot : slots) {
            slot.ifPresent(defined::add);
        }

        int n = defined.size();
        double[] lag = new double[n];
        double[] correntropy = new double[n];
        double[] crossTerm = new double[n];
        int[] support = new int[n];
        for (int i = 0; i < n; i++) {
            SlotEstimate estimate = defined.get(i);
            lag[i] = estimate.lag();
            correntropy[i] = estimate.correntropy();
            crossTerm[i] = estimate.crossTerm() / variance;
            support[i] = estimate.support();
        }

        return new CorrentropyResult(lag, correntropy, bandwidths.bandwidth(), crossTerm,
            bandwidths.slotWidth(), variance, slots.size(), support);
    }

    /**
     * Number of retained slots; the length of every array in this result.
     */
    public int size() {
        return lag.length;
    }

    public boolean isEmpty() {
        return lag.length == 0;
    }

    public double[] lag() {
        return lag.clone();
    }

    public double[] correntropy() {
        return correntropy.clone();
    }

    public double bandwidth() {
        return bandwidth;
    }

    public double[] normalizedCrossTerm() {
        return normalizedCrossTerm.clone();
    }

    public double lagAt(int index) {
        return lag[index];
    }

    public double correntropyAt(int index) {
        return correntropy[index];
    }

    public double normalizedCrossTermAt(int index) {
        return normalizedCrossTerm[index];
    }

    /**
     * Slot width (and lag kernel bandwidth) used for this estimate.
     */
    public double slotWidth() {
        return slotWidth;
    }

    /**
     * Sample variance that normalized the cross terms.
     */
    public double variance() {
        return variance;
    }

    /**
     * Number of lag slots evaluated, including those dropped as empty.
     */
    public int slotsEvaluated() {
        return slotsEvaluated;
    }

    /**
     * Number of pairs that fell in the window of each retained slot.
     */
    public int[] support() {
        return support.clone();
    }

    /**
     * Serializes this result as pretty-printed JSON.
     */
    public String toJson() {
        return SlotCorrGsonConfig.gson().toJson(this);
    }

    @Override
    public String toString() {
        return String.format("CorrentropyResult[slots=%d/%d, sigma=%.6g, slotWidth=%.6g]",
            size(), slotsEvaluated, bandwidth, slotWidth);
    }
}
