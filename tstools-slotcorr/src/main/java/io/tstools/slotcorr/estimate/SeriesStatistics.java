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

import java.util.Objects;

/**
 * Descriptive statistics of the values of one series.
 *
 * <h2>Purpose</h2>
 *
 * <p>Supplies the spread measures the estimator needs: the sample standard
 * deviation that drives the correntropy bandwidth, and the sample variance that
 * normalizes the cross-term series.
 *
 * <h2>Statistics Included</h2>
 *
 * <ul>
 *   <li><b>count</b> - number of observations</li>
 *   <li><b>min/max</b> - observed range</li>
 *   <li><b>mean</b> - arithmetic mean</li>
 *   <li><b>variance/stdDev</b> - population spread (divides by N)</li>
 *   <li><b>sampleVariance/sampleStdDev</b> - unbiased spread (divides by N - 1)</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SeriesStatistics stats = SeriesStatistics.compute(series.values());
 * double sigma = new SilvermanBandwidthSelector().select(stats);
 * }</pre>
 *
 * @see BandwidthSelector
 */
public final class SeriesStatistics {

    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double sumSquaredDeviations;

    /**
     * Constructs statistics from their components.
     *
     * @param sumSquaredDeviations sum of squared deviations from the mean
     */
    public SeriesStatistics(long count, double min, double max, double mean, double sumSquaredDeviations) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.sumSquaredDeviations = sumSquaredDeviations;
    }

    /**
     * Computes statistics from an array of values.
     *
     * @param values the observed values
     * @return computed statistics
     */
    public static SeriesStatistics compute(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        long count = values.length;

        // First pass: min, max, mean
        double min = values[0];
        double max = values[0];
        double sum = 0;

        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }

        double mean = sum / count;

        // Second pass: squared deviations
        double m2 = 0;
        for (double v : values) {
            double diff = v - mean;
            m2 += diff * diff;
        }

        return new SeriesStatistics(count, min, max, mean, m2);
    }

    /**
     * Returns the number of observations.
     */
    public long count() {
        return count;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /**
     * Returns the range (max - min).
     */
    public double range() {
        return max - min;
    }

    public double mean() {
        return mean;
    }

    /**
     * Returns the population variance.
     */
    public double variance() {
        return sumSquaredDeviations / count;
    }

    /**
     * Returns the population standard deviation.
     */
    public double stdDev() {
        return Math.sqrt(variance());
    }

    /**
     * Returns the unbiased sample variance, or 0 for a single observation.
     */
    public double sampleVariance() {
        return count > 1 ? sumSquaredDeviations / (count - 1) : 0.0;
    }

    /**
     * Returns the sample standard deviation.
     */
    public double sampleStdDev() {
        return Math.sqrt(sampleVariance());
    }

    /**
     * Returns whether every observation has the same value.
     */
    public boolean isConstant() {
        return min == max;
    }

    @Override
    public String toString() {
        return String.format(
            "SeriesStatistics[n=%d, range=[%.4f, %.4f], mean=%.4f, sampleStdDev=%.4f]",
            count, min, max, mean, sampleStdDev());
    }
}
