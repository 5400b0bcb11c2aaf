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

/// Silverman's rule-of-thumb bandwidth, scaled for value differences.
///
/// ```
/// sigma = scale * 1.06 * sampleStdDev * N^(-1/5)
/// ```
///
/// The default scale of 2 widens the density-estimation bandwidth because the
/// kernel is applied to the difference of two values, not to a single value.
public final class SilvermanBandwidthSelector implements BandwidthSelector {

    /// Default multiplier applied to the plain Silverman bandwidth.
    public static final double DEFAULT_SCALE = 2.0;

    private static final double SILVERMAN_FACTOR = 1.06;
    private static final double SILVERMAN_EXPONENT = -0.2;

    private final double scale;

    public SilvermanBandwidthSelector() {
        this(DEFAULT_SCALE);
    }

    public SilvermanBandwidthSelector(double scale) {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("scale must be positive and finite, got " + scale);
        }
        this.scale = scale;
    }

    @Override
    public double select(SeriesStatistics stats) {
        Objects.requireNonNull(stats, "stats cannot be null");
        return scale * SILVERMAN_FACTOR * stats.sampleStdDev() * Math.pow(stats.count(), SILVERMAN_EXPONENT);
    }

    @Override
    public String name() {
        return "silverman";
    }

    public double scale() {
        return scale;
    }

    @Override
    public String toString() {
        return "SilvermanBandwidthSelector[scale=" + scale + "]";
    }
}
