package io.tstools.slotcorr;

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

import io.tstools.slotcorr.estimate.BandwidthSelector;
import io.tstools.slotcorr.estimate.FixedBandwidthSelector;
import io.tstools.slotcorr.estimate.SeriesStatistics;
import io.tstools.slotcorr.estimate.SilvermanBandwidthSelector;
import io.tstools.slotcorr.estimate.SlotAverager;
import io.tstools.slotcorr.estimate.SlotSizing;
import io.tstools.slotcorr.model.CorrentropyResult;
import io.tstools.slotcorr.model.KernelBandwidths;
import io.tstools.slotcorr.model.PairwiseDifferences;
import io.tstools.slotcorr.model.SampleSeries;
import io.tstools.slotcorr.model.SlotEstimate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Slotted correntropy estimator for irregularly sampled scalar series.
 *
 * <p>Estimates the correntropy and the autocorrelation-like cross term of a
 * series at regularly spaced lags without resampling it onto a uniform grid.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │ 1. Ordering and pairing                                                 │
 * │    sort by time, build all (lag, dx, x_i*x_j) with i &gt;= j, sort by lag  │
 * ├─────────────────────────────────────────────────────────────────────────┤
 * │ 2. Bandwidth and slot sizing                                            │
 * │    sigma from the value spread, slot width from the mean resolution     │
 * ├─────────────────────────────────────────────────────────────────────────┤
 * │ 3. Windowed weighted averaging (sequential or parallel per slot)        │
 * │    Gaussian-weighted means of lag, correntropy and cross product        │
 * ├─────────────────────────────────────────────────────────────────────────┤
 * │ 4. Normalization and compaction                                         │
 * │    drop empty slots, divide cross terms by the sample variance          │
 * └─────────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * CorrentropyResult result = SlottedCorrentropy.defaults().estimate(times, values);
 *
 * SlottedCorrentropy wide = SlottedCorrentropy.builder()
 *     .lagSpanFraction(0.75)
 *     .computeMode(ComputeMode.PARALLEL)
 *     .build();
 * }</pre>
 *
 * <p>An estimator holds configuration only and may be shared between threads.
 *
 * @see CorrentropyResult
 * @see io.tstools.slotcorr.config.EstimatorConfig
 */
public final class SlottedCorrentropy {

    private static final Logger logger = LogManager.getLogger(SlottedCorrentropy.class);

    /** Default fraction of the observed span covered by lag slots. */
    public static final double DEFAULT_LAG_SPAN_FRACTION = 0.2;

    /** Lag span fraction used for spectrogram-style analysis. */
    public static final double SPECTROGRAM_LAG_SPAN_FRACTION = 0.75;

    /** Default slot width, as a fraction of the mean sampling resolution. */
    public static final double DEFAULT_SLOT_WIDTH_FRACTION = 0.1;

    private final double lagSpanFraction;
    private final double slotWidthFraction;
    private final double windowMultiple;
    private final BandwidthSelector bandwidthSelector;
    private final ComputeMode computeMode;
    private final int parallelism;
    private final ForkJoinPool pool;

    private SlottedCorrentropy(Builder builder) {
        this.lagSpanFraction = builder.lagSpanFraction;
        this.slotWidthFraction = builder.slotWidthFraction;
        this.windowMultiple = builder.windowMultiple;
        this.bandwidthSelector = builder.bandwidthSelector;
        this.computeMode = builder.computeMode;
        this.parallelism = builder.parallelism;
        this.pool = builder.pool;
    }

    /**
     * Returns an estimator with the default settings: 20% lag span, slot width of
     * 0.1 mean resolutions, 5-slot window truncation, Silverman bandwidth, sequential.
     */
    public static SlottedCorrentropy defaults() {
        return builder().build();
    }

    /**
     * Creates a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Estimates from parallel time and value arrays.
     *
     * @param times sample times, any order, duplicates allowed
     * @param values sample values, aligned with {@code times}
     * @return the estimate
     * @throws DegenerateSeriesException for fewer than two samples, zero time span,
     *         constant values, or non-finite input
     */
    public CorrentropyResult estimate(double[] times, double[] values) {
        return estimate(SampleSeries.of(times, values));
    }

    /**
     * Estimates from a sample series.
     *
     * @param series the series, any time order
     * @return the estimate
     * @throws DegenerateSeriesException for fewer than two samples, zero time span,
     *         constant values, values whose variance or products overflow, or an
     *         unusable bandwidth
     */
    public CorrentropyResult estimate(SampleSeries series) {
        Objects.requireNonNull(series, "series cannot be null");

        int n = series.size();
        if (n < 2) {
            throw new DegenerateSeriesException(DegenerateSeriesException.Reason.TOO_FEW_SAMPLES,
                "at least 2 samples are required, got " + n);
        }
        double span = series.span();
        if (!(span > 0)) {
            throw new DegenerateSeriesException(DegenerateSeriesException.Reason.ZERO_TIME_SPAN,
                "all " + n + " samples share the time " + series.minTime());
        }
        SeriesStatistics stats = SeriesStatistics.compute(series.values());
        double peak = Math.max(Math.abs(stats.min()), Math.abs(stats.max()));
        if (!Double.isFinite(stats.sampleVariance()) || Double.isInfinite(peak * peak)) {
            throw new DegenerateSeriesException(DegenerateSeriesException.Reason.NON_FINITE,
                String.format("values in [%s, %s] overflow the variance or the cross products", stats.min(), stats.max()));
        }
        if (stats.isConstant() || !(stats.sampleVariance() > 0)) {
            throw new DegenerateSeriesException(DegenerateSeriesException.Reason.ZERO_VARIANCE,
                "all " + n + " values equal " + stats.min() + "; correntropy bandwidth is undefined");
        }

        double sigma = bandwidthSelector.select(stats);
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new DegenerateSeriesException(DegenerateSeriesException.Reason.INVALID_BANDWIDTH,
                String.format("%s bandwidth selector returned %s for %s", bandwidthSelector.name(), sigma, stats));
        }

        // Stage 1: ordering and pairing
        PairwiseDifferences pairs = PairwiseDifferences.of(series.sortedByTime());

        // Stage 2: slot sizing
        KernelBandwidths bandwidths = SlotSizing.size(sigma, span, n, slotWidthFraction, lagSpanFraction);
        logger.debug("Estimating n={} pairs={} sigma={} slotWidth={} slots={} mode={}",
            n, pairs.size(), sigma, bandwidths.slotWidth(), bandwidths.slotCount(), computeMode);

        // Stage 3: windowed weighted averaging
        SlotAverager averager = new SlotAverager(pairs, bandwidths, windowMultiple);
        List<Optional<SlotEstimate>> slots = computeMode == ComputeMode.PARALLEL
            ? evaluateParallel(averager, bandwidths.slotCount())
            : evaluateSequential(averager, bandwidths.slotCount());

        // Stage 4: normalization and compaction
        CorrentropyResult result = CorrentropyResult.fromSlots(slots, bandwidths, stats.sampleVariance());
        logger.debug("Retained {} of {} slots", result.size(), result.slotsEvaluated());
        return result;
    }

    private List<Optional<SlotEstimate>> evaluateSequential(SlotAverager averager, int slotCount) {
        List<Optional<SlotEstimate>> slots = new ArrayList<>(slotCount);
        for (int k = 0; k < slotCount; k++) {
            slots.add(averager.estimate(k));
        }
        return slots;
    }

    private List<Optional<SlotEstimate>> evaluateParallel(SlotAverager averager, int slotCount) {
        ForkJoinPool effectivePool = pool != null ? pool : new ForkJoinPool(parallelism);
        try {
            return effectivePool.submit(() -> IntStream.range(0, slotCount)
                .parallel()
                .mapToObj(averager::estimate)
                .collect(Collectors.toList())).join();
        } finally {
            if (pool == null) {
                effectivePool.shutdown();
            }
        }
    }

    public double lagSpanFraction() {
        return lagSpanFraction;
    }

    public double slotWidthFraction() {
        return slotWidthFraction;
    }

    /**
     * Window half-width in slot widths; infinite when truncation is disabled.
     */
    public double windowMultiple() {
        return windowMultiple;
    }

    public BandwidthSelector bandwidthSelector() {
        return bandwidthSelector;
    }

    public ComputeMode computeMode() {
        return computeMode;
    }

    public int parallelism() {
        return parallelism;
    }

    @Override
    public String toString() {
        return String.format("SlottedCorrentropy[lagSpan=%.3f, slotWidth=%.3f, window=%s, bandwidth=%s, mode=%s]",
            lagSpanFraction, slotWidthFraction, windowMultiple, bandwidthSelector, computeMode);
    }

    /**
     * Builder for custom SlottedCorrentropy configuration.
     */
    public static final class Builder {
        private double lagSpanFraction = DEFAULT_LAG_SPAN_FRACTION;
        private double slotWidthFraction = DEFAULT_SLOT_WIDTH_FRACTION;
        private double windowMultiple = SlotAverager.DEFAULT_WINDOW_MULTIPLE;
        private BandwidthSelector bandwidthSelector = new SilvermanBandwidthSelector();
        private ComputeMode computeMode = ComputeMode.SEQUENTIAL;
        private int parallelism = ComputeMode.defaultParallelism();
        private ForkJoinPool pool = null;

        private Builder() {}

        /**
         * Sets the fraction of the observed span covered by lag slots, in (0, 1].
         */
        public Builder lagSpanFraction(double lagSpanFraction) {
            if (!(lagSpanFraction > 0) || lagSpanFraction > 1) {
                throw new IllegalArgumentException("lagSpanFraction must be in (0, 1], got " + lagSpanFraction);
            }
            this.lagSpanFraction = lagSpanFraction;
            return this;
        }

        /**
         * Sets the slot width as a fraction of the mean sampling resolution.
         */
        public Builder slotWidthFraction(double slotWidthFraction) {
            if (!(slotWidthFraction > 0) || Double.isInfinite(slotWidthFraction)) {
                throw new IllegalArgumentException("slotWidthFraction must be positive and finite, got " + slotWidthFraction);
            }
            this.slotWidthFraction = slotWidthFraction;
            return this;
        }

        /**
         * Sets the window half-width in slot widths.
         */
        public Builder windowMultiple(double windowMultiple) {
            if (!(windowMultiple > 0)) {
                throw new IllegalArgumentException("windowMultiple must be positive, got " + windowMultiple);
            }
            this.windowMultiple = windowMultiple;
            return this;
        }

        /**
         * Weights every pair in every slot instead of truncating the window.
         */
        public Builder untruncatedWindow() {
            this.windowMultiple = Double.POSITIVE_INFINITY;
            return this;
        }

        /**
         * Sets the correntropy bandwidth selector.
         */
        public Builder bandwidthSelector(BandwidthSelector bandwidthSelector) {
            this.bandwidthSelector = Objects.requireNonNull(bandwidthSelector, "bandwidthSelector cannot be null");
            return this;
        }

        /**
         * Uses Silverman's rule with the given multiplier.
         */
        public Builder bandwidthScale(double scale) {
            this.bandwidthSelector = new SilvermanBandwidthSelector(scale);
            return this;
        }

        /**
         * Uses a fixed correntropy bandwidth for every series.
         */
        public Builder fixedBandwidth(double bandwidth) {
            this.bandwidthSelector = new FixedBandwidthSelector(bandwidth);
            return this;
        }

        /**
         * Sets how slots are evaluated.
         */
        public Builder computeMode(ComputeMode computeMode) {
            this.computeMode = Objects.requireNonNull(computeMode, "computeMode cannot be null");
            return this;
        }

        /**
         * Sets the number of worker threads for {@link ComputeMode#PARALLEL}.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Uses an existing ForkJoinPool for {@link ComputeMode#PARALLEL}.
         * The pool is not shut down by the estimator.
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Builds the estimator.
         */
        public SlottedCorrentropy build() {
            return new SlottedCorrentropy(this);
        }
    }
}
