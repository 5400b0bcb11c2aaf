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

/**
 * Kernel widths chosen for one estimation run.
 *
 * @param bandwidth correntropy kernel bandwidth sigma, applied to value differences
 * @param meanResolution mean sampling interval, {@code span / N}
 * @param slotWidth lag slot width and lag kernel bandwidth
 * @param maxLagIndex largest slot index evaluated; slots run from 0 to this value inclusive
 */
public record KernelBandwidths(
    double bandwidth,
    double meanResolution,
    double slotWidth,
    int maxLagIndex
) {
    /**
     * Number of lag slots evaluated.
     */
    public int slotCount() {
        return maxLagIndex + 1;
    }

    /**
     * Center of slot {@code k}.
     */
    public double slotCenter(int k) {
        return k * slotWidth;
    }
}
