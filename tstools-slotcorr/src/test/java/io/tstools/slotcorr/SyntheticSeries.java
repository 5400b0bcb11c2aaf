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

import io.tstools.slotcorr.model.SampleSeries;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.Arrays;

/**
 * Seeded synthetic series shared by the estimator tests.
 */
public final class SyntheticSeries {

    private SyntheticSeries() {
    }

    /**
     * One period of a sine over {@code [0, span]}, sampled at {@code n} uniformly
     * random times, plus Gaussian noise. Times are returned unsorted.
     */
    public static SampleSeries irregularSine(long seed, int n, double span, double noise) {
        RandomGenerator rng = new Well19937c(seed);
        double[] times = new double[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            times[i] = rng.nextDouble() * span;
            values[i] = Math.sin(2 * Math.PI * times[i] / span) + noise * rng.nextGaussian();
        }
        return SampleSeries.of(times, values);
    }

    /**
     * Returns a copy of the series with its samples shuffled together.
     */
    public static SampleSeries shuffled(SampleSeries series, long seed) {
        RandomGenerator rng = new Well19937c(seed);
        double[] times = series.times();
        double[] values = series.values();
        for (int i = times.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            swap(times, i, j);
            swap(values, i, j);
        }
        return SampleSeries.of(times, values);
    }

    /**
     * Returns a copy of the series with every value multiplied by {@code factor}.
     */
    public static SampleSeries scaled(SampleSeries series, double factor) {
        double[] values = Arrays.stream(series.values()).map(v -> v * factor).toArray();
        return SampleSeries.of(series.times(), values);
    }

    private static void swap(double[] a, int i, int j) {
        double t = a[i];
        a[i] = a[j];
        a[j] = t;
    }
}
