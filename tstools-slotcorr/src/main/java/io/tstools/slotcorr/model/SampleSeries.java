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

import io.tstools.slotcorr.DegenerateSeriesException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

/**
 * An immutable scalar time series of (time, value) samples.
 *
 * <p>Times need not be sorted and may repeat. Both arrays are copied on the way
 * in and on the way out, so a series can be shared freely.
 *
 * <pre>{@code
 * SampleSeries series = SampleSeries.of(
 *     new double[] {3.0, 0.5, 1.2},
 *     new double[] {0.7, -0.1, 0.4});
 * SampleSeries sorted = series.sortedByTime();
 * }</pre>
 */
public final class SampleSeries {

    private final double[] times;
    private final double[] values;

    private SampleSeries(double[] times, double[] values) {
        this.times = times;
        this.values = values;
    }

    /**
     * Creates a series from parallel time and value arrays.
     *
     * @param times sample times, any order
     * @param values sample values, {@code values[i]} observed at {@code times[i]}
     * @return the series
     * @throws IllegalArgumentException if the arrays differ in length
     * @throws DegenerateSeriesException if any time or value is NaN or infinite
     */
    public static SampleSeries of(double[] times, double[] values) {
        Objects.requireNonNull(times, "times cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (times.length != values.length) {
            throw new IllegalArgumentException(
                "times and values must have the same length: " + times.length + " vs " + values.length);
        }
        for (int i = 0; i < times.length; i++) {
            if (!Double.isFinite(times[i]) || !Double.isFinite(values[i])) {
                throw new DegenerateSeriesException(DegenerateSeriesException.Reason.NON_FINITE,
                    String.format("sample %d is not finite: t=%s, x=%s", i, times[i], values[i]));
            }
        }
        return new SampleSeries(times.clone(), values.clone());
    }

    /**
     * Returns a copy of this series ordered by ascending time.
     *
     * <p>The sort is stable: samples sharing a timestamp keep their relative order,
     * and each value moves with its time.
     */
    public SampleSeries sortedByTime() {
        int n = times.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> times[i]));

        double[] sortedTimes = new double[n];
        double[] sortedValues = new double[n];
        for (int i = 0; i < n; i++) {
            sortedTimes[i] = times[order[i]];
            sortedValues[i] = values[order[i]];
        }
        return new SampleSeries(sortedTimes, sortedValues);
    }

    /**
     * Returns whether the times are already in non-decreasing order.
     */
    public boolean isTimeOrdered() {
        for (int i = 1; i < times.length; i++) {
            if (times[i] < times[i - 1]) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return times.length;
    }

    public double time(int index) {
        return times[index];
    }

    public double value(int index) {
        return values[index];
    }

    /**
     * Returns a copy of the sample times.
     */
    public double[] times() {
        return times.clone();
    }

    /**
     * Returns a copy of the sample values.
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * Returns the smallest sample time, or NaN for an empty series.
     */
    public double minTime() {
        return Arrays.stream(times).min().orElse(Double.NaN);
    }

    /**
     * Returns the largest sample time, or NaN for an empty series.
     */
    public double maxTime() {
        return Arrays.stream(times).max().orElse(Double.NaN);
    }

    /**
     * Returns the observed time span (max time - min time).
     */
    public double span() {
        return maxTime() - minTime();
    }

    @Override
    public String toString() {
        return String.format("SampleSeries[n=%d, t=[%.4f, %.4f]]", size(), minTime(), maxTime());
    }
}
