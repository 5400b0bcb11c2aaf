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

/// Chooses the bandwidth sigma of the correntropy kernel.
///
/// ## Purpose
///
/// The correntropy of a pair is `exp(-dx^2 / (2 sigma^2))`, where `dx` is the
/// difference of the two values. Sigma sets the scale at which two values still
/// count as similar. Implementations derive it from the value statistics of the
/// series, or ignore them and return a fixed width.
///
/// ## Usage
///
/// ```java
/// BandwidthSelector selector = new SilvermanBandwidthSelector();
/// double sigma = selector.select(SeriesStatistics.compute(values));
/// ```
///
/// @see SilvermanBandwidthSelector
/// @see FixedBandwidthSelector
public interface BandwidthSelector {

    /// Returns the kernel bandwidth for a series with the given statistics.
    ///
    /// @param stats value statistics of the series
    /// @return a positive bandwidth
    double select(SeriesStatistics stats);

    /// Short identifier used in logs and configuration.
    String name();
}
