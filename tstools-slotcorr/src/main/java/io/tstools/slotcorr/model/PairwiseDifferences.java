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

import java.util.Objects;

/**
 * All time-ordered sample pairs of a series, flattened and sorted by lag.
 *
 * <h2>Layout</h2>
 *
 * <p>For a time-sorted series of N samples, every index pair (i, j) with
 * {@code i >= j} contributes one entry (the self pairs included):
 * <ul>
 *   <li><b>lag</b> - {@code t[i] - t[j]}, never negative</li>
 *   <li><b>valueDifference</b> - {@code x[i] - x[j]}</li>
 *   <li><b>product</b> - {@code x[i] * x[j]}</li>
 * </ul>
 *
 * <p>The three quantities live in parallel arrays of exactly N(N+1)/2 entries,
 * allocated once. After construction the entries are reordered by ascending lag
 * (stable with respect to construction order), so the pairs that fall inside a
 * lag window form one contiguous run that {@link #lowerBound(double)} can find
 * by binary search.
 */
public final class PairwiseDifferences {

    /** Largest entry count a Java array can reliably hold. */
    public static final long MAX_PAIRS = Integer.MAX_VALUE - 8;

    private final double[] lags;
    private final double[] valueDifferences;
    private final double[] products;

    private PairwiseDifferences(double[] lags, double[] valueDifferences, double[] products) {
        this.lags = lags;
        this.valueDifferences = valueDifferences;
        this.products = products;
    }

    /**
     * Returns the number of pairs a series of {@code n} samples produces.
     */
    public static long pairCount(int n) {
        return (long) n * (n + 1) / 2;
    }

    /**
     * Builds the lag-sorted pair set of a series.
     *
     * @param series the series; it is time-sorted first if it is not already
     * @return the pairwise differences
     * @throws IllegalArgumentException if the pair count does not fit an array
     */
    public static PairwiseDifferences of(SampleSeries series) {
        Objects.requireNonNull(series, "series cannot be null");
        SampleSeries sorted = series.isTimeOrdered() ? series : series.sortedByTime();

        int n = sorted.size();
        long count = pairCount(n);
        if (count > MAX_PAIRS) {
            throw new IllegalArgumentException(String.format(
                "%d samples produce %d pairs, more than the %d that fit in memory", n, count, MAX_PAIRS));
        }

        int size = (int) count;
        double[] lag = new double[size];
        double[] dx = new double[size];
        double[] prod = new double[size];

        int e = 0;
        for (int i = 0; i < n; i++) {
            double ti = sorted.time(i);
            double xi = sorted.value(i);
            for (int j = 0; j <= i; j++) {
                double xj = sorted.value(j);
                lag[e] = ti - sorted.time(j);
                dx[e] = xi - xj;
                prod[e] = xi * xj;
                e++;
            }
        }

        int[] order = sortIndicesByKey(lag);
        return new PairwiseDifferences(
            permute(lag, order),
            permute(dx, order),
            permute(prod, order));
    }

    public int size() {
        return lags.length;
    }

    public double lag(int index) {
        return lags[index];
    }

    public double valueDifference(int index) {
        return valueDifferences[index];
    }

    public double product(int index) {
        return products[index];
    }

    /**
     * Returns the largest lag in the set, or 0 when it is empty.
     */
    public double maxLag() {
        return lags.length == 0 ? 0.0 : lags[lags.length - 1];
    }

    /**
     * Returns the index of the first entry whose lag is {@code >= target},
     * or {@link #size()} if there is none.
     */
    public int lowerBound(double target) {
        int lo = 0;
        int hi = lags.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (lags[mid] < target) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    @Override
    public String toString() {
        return String.format("PairwiseDifferences[pairs=%d, maxLag=%.4f]", size(), maxLag());
    }

    private static double[] permute(double[] source, int[] order) {
        double[] target = new double[source.length];
        for (int i = 0; i < order.length; i++) {
            target[i] = source[order[i]];
        }
        return target;
    }

    /// Stable bottom-up merge sort of entry indices by key.
    private static int[] sortIndicesByKey(double[] keys) {
        int n = keys.length;
        int[] src = new int[n];
        for (int i = 0; i < n; i++) {
            src[i] = i;
        }
        int[] dst = new int[n];

        for (long width = 1; width < n; width *= 2) {
            for (long left = 0; left < n; left += 2 * width) {
                int mid = (int) Math.min(left + width, n);
                int right = (int) Math.min(left + 2 * width, n);
                int a = (int) left;
                int b = mid;
                int out = (int) left;
                while (a < mid && b < right) {
                    // <= keeps equal keys in their original order
                    if (keys[src[a]] <= keys[src[b]]) {
                        dst[out++] = src[a++];
                    } else {
                        dst[out++] = src[b++];
                    }
                }
                while (a < mid) {
                    dst[out++] = src[a++];
                }
                while (b < right) {
                    dst[out++] = src[b++];
                }
            }
            int[] swap = src;
            src = dst;
            dst = swap;
        }
        return src;
    }
}
