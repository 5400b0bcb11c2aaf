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

/**
 * The two Gaussian kernels of the estimator.
 */
public final class GaussianKernel {

    private static final double TWO_PI = 2.0 * Math.PI;

    private GaussianKernel() {
        // Utility class
    }

    /**
     * Lag weight of a pair whose lag is {@code offset} away from a slot center.
     *
     * <p>{@code 1 / (2 pi h) * exp(-offset^2 / (2 h^2))}. The leading constant
     * cancels in every weighted average but is kept so raw weight sums are
     * comparable between runs with the same slot width.
     *
     * @param offset pair lag minus slot center
     * @param width slot width h
     */
    public static double slotWeight(double offset, double width) {
        double u = offset / width;
        return Math.exp(-0.5 * u * u) / (TWO_PI * width);
    }

    /**
     * Correntropy of two values differing by {@code difference}, in (0, 1].
     *
     * @param difference value difference
     * @param sigma correntropy bandwidth
     */
    public static double correntropy(double difference, double sigma) {
        double u = difference / sigma;
        return Math.exp(-0.5 * u * u);
    }
}
