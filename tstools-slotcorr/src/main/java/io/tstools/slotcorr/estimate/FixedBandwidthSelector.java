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

/// Returns the same caller-supplied bandwidth for every series.
public final class FixedBandwidthSelector implements BandwidthSelector {

    private final double bandwidth;

    public FixedBandwidthSelector(double bandwidth) {
        if (!(bandwidth > 0) || Double.isInfinite(bandwidth)) {
            throw new IllegalArgumentException("bandwidth must be positive and finite, got " + bandwidth);
        }
        this.bandwidth = bandwidth;
    }

    @Override
    public double select(SeriesStatistics stats) {
        return bandwidth;
    }

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public String toString() {
        return "FixedBandwidthSelector[bandwidth=" + bandwidth + "]";
    }
}
